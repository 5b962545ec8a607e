package org.example.biolearn.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QuizView(
        String id,
        @JsonProperty("chapter_slug") String chapterSlug,
        String question,
        List<String> options,
        @JsonProperty("correct_index") Integer correctIndex,
        String explanation,
        String difficulty
) {
}
