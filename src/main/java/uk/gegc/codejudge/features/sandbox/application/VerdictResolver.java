package uk.gegc.codejudge.features.sandbox.application;

import uk.gegc.codejudge.features.sandbox.domain.model.ResolvedExecution;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

public interface VerdictResolver {

    ResolvedExecution resolve(SandboxResult result);

    Verdict verdictFor(Integer statusId);
}
