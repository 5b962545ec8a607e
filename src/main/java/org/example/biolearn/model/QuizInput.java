package org.example.biolearn.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Payload for creating a quiz question. {@code difficulty} may be omitted.
 * The range of {@code correctIndex} is checked against {@code options} by the service.
 */
public record QuizInput(
        @JsonProperty("chapter_slug") @NotBlank String chapterSlug,
        @NotBlank String question,
        @NotNull @Size(min = 2) List<@NotNull String> options,
        @JsonProperty("correct_index") @NotNull Integer correctIndex,
        @NotBlank String explanation,
        String difficulty
) {
}
