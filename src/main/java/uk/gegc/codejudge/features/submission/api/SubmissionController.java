package uk.gegc.codejudge.features.submission.api;

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
import uk.gegc.codejudge.features.submission.api.dto.*;
import uk.gegc.codejudge.features.submission.application.SubmissionService;

import java.util.UUID;

@Tag(name = "Submissions", description = "Judge practice submissions and inspect their results")
@RestController
@RequestMapping("/api/v1/submissions")
@RequiredArgsConstructor
@Validated
public class SubmissionController {

    private final SubmissionService submissionService;

    @Operation(
            summary = "Submit a solution",
            description = "Judges the code against every active test case of the problem. The response carries the final verdict."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Submission judged",
                    content = @Content(schema = @Schema(implementation = SubmissionDetailDto.class))),
            @ApiResponse(responseCode = "400", description = "Empty or oversized code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "User is banned",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Problem not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SubmissionDetailDto> submit(
            @RequestBody @Valid SubmitSolutionRequest request,
            Authentication authentication
    ) {
        SubmissionDetailDto dto = submissionService.submit(authentication.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Run against sample cases", description = "Executes the code on the sample test cases only. Nothing is stored.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Run finished",
                    content = @Content(schema = @Schema(implementation = RunResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Empty or oversized code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/run")
    public ResponseEntity<RunResultDto> run(
            @RequestBody @Valid RunCodeRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(submissionService.run(authentication.getName(), request));
    }

    @Operation(summary = "Get a submission", description = "Owners also receive the code and per-case results.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission returned"),
            @ApiResponse(responseCode = "404", description = "Submission not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{submissionId}")
    public ResponseEntity<SubmissionDetailDto> getSubmission(
            @Parameter(description = "Submission UUID", required = true) @PathVariable UUID submissionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(submissionService.getSubmission(authentication.getName(), submissionId));
    }

    @Operation(summary = "List my submissions", description = "Newest first.")
    @GetMapping("/me")
    public ResponseEntity<Page<SubmissionDto>> getMySubmissions(
            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            Authentication authentication
    ) {
        Page<SubmissionDto> result = submissionService.getMySubmissions(
                authentication.getName(),
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "submittedAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "My submission statistics", description = "Counts per verdict and acceptance rate.")
    @GetMapping("/me/stats")
    public ResponseEntity<SubmissionStatsDto> getMyStats(Authentication authentication) {
        return ResponseEntity.ok(submissionService.getMyStats(authentication.getName()));
    }
}
