package uk.gegc.codejudge.features.submission.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.codejudge.features.submission.api.dto.RunCodeRequest;
import uk.gegc.codejudge.features.submission.api.dto.RunResultDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDetailDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionStatsDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmitSolutionRequest;

import java.util.UUID;

public interface SubmissionService {

    /**
     * Judges the code against every active test case of the problem and stores the verdict,
     * per-case results and statistics in one transaction. Judging itself runs outside any
     * transaction.
     */
    SubmissionDetailDto submit(String username, SubmitSolutionRequest request);

    /**
     * Runs the code against the sample cases only. Stores nothing.
     */
    RunResultDto run(String username, RunCodeRequest request);

    SubmissionDetailDto getSubmission(String username, UUID submissionId);

    Page<SubmissionDto> getMySubmissions(String username, Pageable pageable);

    SubmissionStatsDto getMyStats(String username);
}
