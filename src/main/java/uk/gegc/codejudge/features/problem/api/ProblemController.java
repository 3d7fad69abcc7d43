package uk.gegc.codejudge.features.problem.api;

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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.codejudge.features.problem.api.dto.ProblemStatisticsDto;
import uk.gegc.codejudge.features.problem.application.ProblemStatisticsService;

@Tag(name = "Problems", description = "Read-only problem statistics")
@RestController
@RequestMapping("/api/v1/problems")
@RequiredArgsConstructor
public class ProblemController {

    private final ProblemStatisticsService problemStatisticsService;

    @Operation(summary = "Get problem statistics", description = "Submission, acceptance and solve counters for an active problem.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics returned",
                    content = @Content(schema = @Schema(implementation = ProblemStatisticsDto.class))),
            @ApiResponse(responseCode = "404", description = "Problem not found or inactive",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{slug}/statistics")
    public ResponseEntity<ProblemStatisticsDto> getStatistics(
            @Parameter(description = "Problem slug", required = true) @PathVariable String slug
    ) {
        return ResponseEntity.ok(problemStatisticsService.getStatistics(slug));
    }
}
