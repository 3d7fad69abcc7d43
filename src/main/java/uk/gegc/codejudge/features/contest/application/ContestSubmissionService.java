package uk.gegc.codejudge.features.contest.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmissionDetailDto;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmissionDto;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmitRequest;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmitResultDto;

import java.util.UUID;

public interface ContestSubmissionService {

    /**
     * Judges a contest submission, scores it and re-ranks the contest.
     * <p>
     * Rejected without writing anything when the code is invalid, the contest is not
     * running, the caller is not registered, or the problem is not an active problem of
     * the contest.
     * </p>
     */
    ContestSubmitResultDto submit(String username, String contestSlug, ContestSubmitRequest request);

    ContestSubmissionDetailDto getSubmission(String username, UUID submissionId);

    Page<ContestSubmissionDto> getMySubmissions(String username, String contestSlug, Pageable pageable);
}
