package uk.gegc.codejudge.features.user.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.codejudge.features.user.api.dto.UserLeaderboardEntryDto;
import uk.gegc.codejudge.features.user.api.dto.UserSolveStatsDto;
import uk.gegc.codejudge.features.user.application.UserStatsService;

import java.util.List;

@Tag(name = "Users", description = "Global leaderboard and per-user solve counters")
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserStatsService userStatsService;

    @Operation(summary = "Global leaderboard", description = "Users ordered by problems solved. Public.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Leaderboard returned"),
            @ApiResponse(responseCode = "400", description = "Limit out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/leaderboard")
    public ResponseEntity<List<UserLeaderboardEntryDto>> getLeaderboard(
            @Parameter(description = "Maximum number of rows (1-500)", example = "100")
            @RequestParam(defaultValue = "100") int limit
    ) {
        return ResponseEntity.ok(userStatsService.getLeaderboard(limit));
    }

    @Operation(summary = "Get my solve stats")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stats returned",
                    content = @Content(schema = @Schema(implementation = UserSolveStatsDto.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me/stats")
    public ResponseEntity<UserSolveStatsDto> getMyStats(Authentication authentication) {
        return ResponseEntity.ok(userStatsService.getMyStats(authentication.getName()));
    }
}
