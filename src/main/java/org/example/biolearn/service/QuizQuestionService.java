package org.example.biolearn.service;

import org.example.biolearn.config.ContentApiProperties;
import org.example.biolearn.model.QuizInput;
import org.example.biolearn.model.QuizView;
import org.example.biolearn.repository.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static org.example.biolearn.service.ContentDocumentMapper.CHAPTER_SLUG;
import static org.example.biolearn.service.ContentDocumentMapper.QUIZ_COLLECTION;

@Service
public class QuizQuestionService {

    private static final Logger log = LoggerFactory.getLogger(QuizQuestionService.class);

    static final int MIN_OPTIONS = 2;

    private final DocumentStore documentStore;
    private final ContentDocumentMapper mapper;
    private final ContentApiProperties properties;

    public QuizQuestionService(DocumentStore documentStore,
                               ContentDocumentMapper mapper,
                               ContentApiProperties properties) {
        this.documentStore = documentStore;
        this.mapper = mapper;
        this.properties = properties;
    }

    /**
     * Returns up to {@code limit} questions for the slug. The chapter itself is not looked up,
     * so an unknown slug yields an empty list. A null limit uses the configured default; zero means no limit.
     */
    public List<QuizView> getQuizForChapter(String chapterSlug, Integer limit) {
        int effectiveLimit = limit == null ? properties.getQuiz().getDefaultLimit() : limit;
        if (effectiveLimit < 0) {
            throw new InvalidContentException("limit must not be negative");
        }
        return documentStore.findMany(QUIZ_COLLECTION, Map.of(CHAPTER_SLUG, chapterSlug), effectiveLimit).stream()
                .map(mapper::toQuizView)
                .toList();
    }

    public String createQuizItem(QuizInput input) {
        validate(input);
        String id = documentStore.insert(QUIZ_COLLECTION, mapper.toDocument(input));
        log.info("Created quiz question for chapter {} (id={})", input.chapterSlug(), id);
        return id;
    }

    static void validate(QuizInput input) {
        List<String> options = input.options();
        if (options == null || options.size() < MIN_OPTIONS) {
            throw new InvalidContentException("options must contain at least " + MIN_OPTIONS + " entries");
        }
        Integer correctIndex = input.correctIndex();
        if (correctIndex == null || correctIndex < 0 || correctIndex >= options.size()) {
            throw new InvalidContentException("correct_index out of range");
        }
    }
}
