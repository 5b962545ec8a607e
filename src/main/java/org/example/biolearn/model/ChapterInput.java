package org.example.biolearn.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Payload for creating a chapter. {@code objectives} and {@code sections} may be omitted.
 */
public record ChapterInput(
        @NotBlank
        @Size(max = 120)
        @Pattern(regexp = "[A-Za-z0-9._~-]+", message = "must contain only URL-safe characters")
        String slug,
        @NotBlank String title,
        @NotBlank String summary,
        List<@NotNull String> objectives,
        List<@NotNull Map<String, String>> sections
) {
}
