package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.contest.domain.model.ContestStatus;

import java.time.Instant;

@Schema(name = "TimeInfoDto", description = "Contest timing relative to now. Only the fields relevant to the current status are set.")
public record TimeInfoDto(
        @Schema(description = "Current status", example = "ACTIVE")
        ContestStatus status,

        Instant startTime,

        Instant endTime,

        @Schema(description = "Seconds until the start, upcoming contests only")
        Long secondsUntilStart,

        @Schema(description = "Seconds until the end, running contests only")
        Long secondsRemaining,

        @Schema(description = "Seconds since the start, running contests only")
        Long secondsElapsed,

        @Schema(description = "Contest length in seconds, ended contests only")
        Long totalDurationSeconds
) {
}
