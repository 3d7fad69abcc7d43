package uk.gegc.codejudge.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Single source of time for the application.
 * <p>
 * Contest windows, solve times and activity days are all derived from this clock. The zone
 * decides where an activity day starts and ends; instants themselves are always stored in UTC.
 */
@Slf4j
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.timezone:UTC}") String timezone) {
        return Clock.system(resolveZone(timezone));
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalStateException("Invalid app.timezone '" + timezone + "'", ex);
        }
    }
}
