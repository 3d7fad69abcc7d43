package uk.gegc.codejudge.features.problem.application;

import uk.gegc.codejudge.features.problem.api.dto.ProblemStatisticsDto;

public interface ProblemStatisticsService {

    ProblemStatisticsDto getStatistics(String slug);
}
