package uk.gegc.codejudge.features.submission.domain.repository;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

public interface VerdictCountProjection {

    Verdict getVerdict();

    Long getTotal();
}
