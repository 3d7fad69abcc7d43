package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "ContestRegistrationDto", description = "A user's registration for a contest")
public record ContestRegistrationDto(
        @Schema(example = "weekly-42")
        String contestSlug,

        @Schema(example = "alice")
        String username,

        Instant registeredAt
) {
}
