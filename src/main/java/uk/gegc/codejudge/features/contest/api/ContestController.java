package uk.gegc.codejudge.features.contest.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.codejudge.features.contest.api.dto.*;
import uk.gegc.codejudge.features.contest.application.ContestService;
import uk.gegc.codejudge.features.contest.application.ContestSubmissionService;

import java.util.List;
import java.util.UUID;

@Tag(name = "Contests", description = "Contest registration, judging and leaderboards")
@RestController
@RequestMapping("/api/v1/contests")
@RequiredArgsConstructor
@Validated
public class ContestController {

    private final ContestService contestService;
    private final ContestSubmissionService contestSubmissionService;

    @Operation(summary = "Register for a contest", description = "Allowed until the contest starts.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered",
                    content = @Content(schema = @Schema(implementation = ContestRegistrationDto.class))),
            @ApiResponse(responseCode = "400", description = "Registration closed or already registered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Contest not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{slug}/register")
    public ResponseEntity<ContestRegistrationDto> register(
            @Parameter(description = "Contest slug", required = true) @PathVariable String slug,
            Authentication authentication
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contestService.register(authentication.getName(), slug));
    }

    @Operation(summary = "Withdraw a registration", description = "Allowed until the contest starts.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Registration removed"),
            @ApiResponse(responseCode = "400", description = "Contest already started, or not registered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{slug}/register")
    public ResponseEntity<Void> unregister(@PathVariable String slug, Authentication authentication) {
        contestService.unregister(authentication.getName(), slug);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Submit a contest solution",
            description = "Judges the code, scores it and re-ranks the contest. Requires a registration and a running contest."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Submission judged",
                    content = @Content(schema = @Schema(implementation = ContestSubmitResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid code, contest not running, or not registered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Contest or problem not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{slug}/submissions")
    public ResponseEntity<ContestSubmitResultDto> submit(
            @Parameter(description = "Contest slug", required = true) @PathVariable String slug,
            @RequestBody @Valid ContestSubmitRequest request,
            Authentication authentication
    ) {
        ContestSubmitResultDto result = contestSubmissionService.submit(authentication.getName(), slug, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @Operation(summary = "List my contest submissions", description = "Newest first.")
    @GetMapping("/{slug}/submissions/me")
    public ResponseEntity<Page<ContestSubmissionDto>> getMySubmissions(
            @PathVariable String slug,

            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            Authentication authentication
    ) {
        Page<ContestSubmissionDto> result = contestSubmissionService.getMySubmissions(
                authentication.getName(),
                slug,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "submittedAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get a contest submission", description = "Only the author may view it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission returned"),
            @ApiResponse(responseCode = "403", description = "Not the author",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Submission not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/submissions/{submissionId}")
    public ResponseEntity<ContestSubmissionDetailDto> getSubmission(
            @PathVariable UUID submissionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(contestSubmissionService.getSubmission(authentication.getName(), submissionId));
    }

    @Operation(summary = "Contest leaderboard", description = "Participants in rank order. Public.")
    @GetMapping("/{slug}/leaderboard")
    public ResponseEntity<List<LeaderboardEntryDto>> getLeaderboard(@PathVariable String slug) {
        return ResponseEntity.ok(contestService.getLeaderboard(slug));
    }

    @Operation(summary = "Detailed contest leaderboard", description = "Leaderboard with per-problem progress of every participant. Public.")
    @GetMapping("/{slug}/leaderboard/detailed")
    public ResponseEntity<List<DetailedLeaderboardEntryDto>> getDetailedLeaderboard(@PathVariable String slug) {
        return ResponseEntity.ok(contestService.getDetailedLeaderboard(slug));
    }

    @Operation(summary = "My contest dashboard", description = "Standing, per-problem progress, recent submissions and timing.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dashboard returned"),
            @ApiResponse(responseCode = "400", description = "Not registered",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{slug}/dashboard")
    public ResponseEntity<ContestDashboardDto> getDashboard(@PathVariable String slug, Authentication authentication) {
        return ResponseEntity.ok(contestService.getDashboard(authentication.getName(), slug));
    }
}
