package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;

import java.util.UUID;

@Schema(name = "ContestSubmitRequest", description = "Solution to a contest problem")
public record ContestSubmitRequest(
        @Schema(description = "Contest problem UUID", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Problem id must be provided")
        UUID problemId,

        @Schema(description = "Source code, at most 50,000 bytes", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Code must not be empty")
        String code,

        @Schema(description = "Programming language", example = "CPP", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Language must be provided")
        Language language
) {
}
