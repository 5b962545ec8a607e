package org.example.biolearn.service;

import org.example.biolearn.model.ChapterInput;
import org.example.biolearn.model.ChapterView;
import org.example.biolearn.model.QuizInput;
import org.example.biolearn.model.QuizView;
import org.example.biolearn.repository.DocumentStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates between API payloads and stored documents.
 * <p>
 * Stored field names follow the wire names ({@code chapter_slug}, {@code correct_index}).
 * When reading, the store identifier is exposed as a string {@code id} and missing optional
 * fields fall back to their defaults.
 */
@Component
public class ContentDocumentMapper {

    public static final String CHAPTER_COLLECTION = "chapter";
    public static final String QUIZ_COLLECTION = "quizquestion";
    public static final String DEFAULT_DIFFICULTY = "OSN-N";

    public static final String SLUG = "slug";
    public static final String TITLE = "title";
    public static final String SUMMARY = "summary";
    public static final String OBJECTIVES = "objectives";
    public static final String SECTIONS = "sections";

    public static final String CHAPTER_SLUG = "chapter_slug";
    public static final String QUESTION = "question";
    public static final String OPTIONS = "options";
    public static final String CORRECT_INDEX = "correct_index";
    public static final String EXPLANATION = "explanation";
    public static final String DIFFICULTY = "difficulty";

    public Map<String, Object> toDocument(ChapterInput input) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SLUG, input.slug());
        document.put(TITLE, input.title());
        document.put(SUMMARY, input.summary());
        document.put(OBJECTIVES, input.objectives() == null ? new ArrayList<>() : new ArrayList<>(input.objectives()));
        List<Map<String, String>> sections = new ArrayList<>();
        if (input.sections() != null) {
            for (Map<String, String> section : input.sections()) {
                sections.add(new LinkedHashMap<>(section));
            }
        }
        document.put(SECTIONS, sections);
        return document;
    }

    public Map<String, Object> toDocument(QuizInput input) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(CHAPTER_SLUG, input.chapterSlug());
        document.put(QUESTION, input.question());
        document.put(OPTIONS, new ArrayList<>(input.options()));
        document.put(CORRECT_INDEX, input.correctIndex());
        document.put(EXPLANATION, input.explanation());
        document.put(DIFFICULTY, input.difficulty() == null ? DEFAULT_DIFFICULTY : input.difficulty());
        return document;
    }

    public ChapterView toChapterView(Map<String, Object> document) {
        return new ChapterView(
                idOf(document),
                stringOf(document.get(SLUG)),
                stringOf(document.get(TITLE)),
                stringOf(document.get(SUMMARY)),
                stringList(document.get(OBJECTIVES)),
                sectionList(document.get(SECTIONS))
        );
    }

    public QuizView toQuizView(Map<String, Object> document) {
        Object difficulty = document.get(DIFFICULTY);
        return new QuizView(
                idOf(document),
                stringOf(document.get(CHAPTER_SLUG)),
                stringOf(document.get(QUESTION)),
                stringList(document.get(OPTIONS)),
                document.get(CORRECT_INDEX) instanceof Number number ? number.intValue() : null,
                stringOf(document.get(EXPLANATION)),
                difficulty == null ? DEFAULT_DIFFICULTY : difficulty.toString()
        );
    }

    private String idOf(Map<String, Object> document) {
        return stringOf(document.get(DocumentStore.ID_FIELD));
    }

    private String stringOf(Object value) {
        return Objects.toString(value, null);
    }

    private List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(stringOf(item));
        }
        return result;
    }

    // Non-map entries are dropped; values are stringified.
    private List<Map<String, String>> sectionList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, String>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, String> section = new LinkedHashMap<>();
                map.forEach((key, val) -> section.put(String.valueOf(key), stringOf(val)));
                result.add(section);
            }
        }
        return result;
    }
}
