package org.example.biolearn.service;

import org.example.biolearn.model.QuizInput;
import org.example.biolearn.repository.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

import static org.example.biolearn.service.ContentDocumentMapper.CHAPTER_COLLECTION;
import static org.example.biolearn.service.ContentDocumentMapper.QUIZ_COLLECTION;

/**
 * Inserts the sample chapter and its questions into an empty store.
 * Any existing chapter, seeded or not, makes the call a no-op.
 */
@Service
public class SeedService {

    private static final Logger log = LoggerFactory.getLogger(SeedService.class);

    private final DocumentStore documentStore;
    private final ContentDocumentMapper mapper;

    public SeedService(DocumentStore documentStore, ContentDocumentMapper mapper) {
        this.documentStore = documentStore;
        this.mapper = mapper;
    }

    public SeedResult seed() {
        if (documentStore.findOne(CHAPTER_COLLECTION, Map.of()).isPresent()) {
            log.info("Chapters already present, skipping seed");
            return SeedResult.ALREADY_SEEDED;
        }

        documentStore.insert(CHAPTER_COLLECTION, mapper.toDocument(SeedContent.CHAPTER));
        for (QuizInput question : SeedContent.QUESTIONS) {
            documentStore.insert(QUIZ_COLLECTION, mapper.toDocument(question));
        }
        log.info("Seeded chapter {} with {} quiz questions", SeedContent.CHAPTER_SLUG, SeedContent.QUESTIONS.size());
        return SeedResult.SEEDED;
    }
}
