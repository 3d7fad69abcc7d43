package uk.gegc.codejudge.features.problem.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.problem.api.dto.ProblemStatisticsDto;
import uk.gegc.codejudge.features.problem.application.ProblemStatisticsService;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemRepository;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProblemStatisticsServiceImpl implements ProblemStatisticsService {

    private final ProblemRepository problemRepository;

    @Override
    public ProblemStatisticsDto getStatistics(String slug) {
        Problem problem = problemRepository.findBySlugAndActiveTrue(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Problem " + slug + " not found"));
        return new ProblemStatisticsDto(
                problem.getId(),
                problem.getSlug(),
                problem.getTitle(),
                problem.getDifficulty(),
                problem.getTotalSubmissions(),
                problem.getAcceptedSubmissions(),
                problem.getTotalSolved(),
                problem.getAcceptanceRate()
        );
    }
}
