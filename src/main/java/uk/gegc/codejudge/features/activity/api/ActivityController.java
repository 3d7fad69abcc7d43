package uk.gegc.codejudge.features.activity.api;

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
import uk.gegc.codejudge.features.activity.api.dto.AchievementDto;
import uk.gegc.codejudge.features.activity.api.dto.StreakDto;
import uk.gegc.codejudge.features.activity.application.ActivityService;

import java.util.List;

@Tag(name = "Activity", description = "Solving streaks, activity calendar and achievements")
@RestController
@RequestMapping("/api/v1/activity")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityService activityService;

    @Operation(summary = "Get my streak", description = "Current solving streak plus the activity calendar for the last N days.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Streak returned",
                    content = @Content(schema = @Schema(implementation = StreakDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid day window",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me/streak")
    public ResponseEntity<StreakDto> getMyStreak(
            @Parameter(description = "Calendar window in days", example = "30")
            @RequestParam(defaultValue = "30") int days,
            Authentication authentication
    ) {
        return ResponseEntity.ok(activityService.getMyStreak(authentication.getName(), days));
    }

    @Operation(summary = "Get my achievements", description = "Achievements earned so far, oldest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Achievements returned"),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me/achievements")
    public ResponseEntity<List<AchievementDto>> getMyAchievements(Authentication authentication) {
        return ResponseEntity.ok(activityService.getMyAchievements(authentication.getName()));
    }
}
