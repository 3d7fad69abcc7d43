package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;

@Schema(name = "SubmitSolutionRequest", description = "Source code to judge against all test cases of a problem")
public record SubmitSolutionRequest(
        @Schema(description = "Problem slug", example = "two-sum", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Problem slug must not be blank")
        @Size(max = 200, message = "Problem slug must be at most 200 characters")
        String problemSlug,

        @Schema(description = "Source code, at most 50,000 bytes", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Code must not be empty")
        String code,

        @Schema(description = "Programming language", example = "PYTHON", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Language must be provided")
        Language language
) {
}
