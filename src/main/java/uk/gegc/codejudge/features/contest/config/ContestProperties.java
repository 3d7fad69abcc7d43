package uk.gegc.codejudge.features.contest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "codejudge.contest")
public class ContestProperties {

    /**
     * Minutes added to a participant's penalty time for each wrong attempt on a problem
     * they later solve.
     */
    private int penaltyMinutes = 20;

    /**
     * How many of the caller's latest submissions the contest dashboard shows.
     */
    private int dashboardRecentSubmissions = 10;
}
