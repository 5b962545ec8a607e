package org.example.biolearn.service;

import org.example.biolearn.model.ChapterInput;
import org.example.biolearn.model.ChapterView;
import org.example.biolearn.repository.DocumentStore;
import org.example.biolearn.repository.DuplicateDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.example.biolearn.service.ContentDocumentMapper.CHAPTER_COLLECTION;
import static org.example.biolearn.service.ContentDocumentMapper.SLUG;

@Service
public class ChapterService {

    private static final Logger log = LoggerFactory.getLogger(ChapterService.class);

    private final DocumentStore documentStore;
    private final ContentDocumentMapper mapper;

    public ChapterService(DocumentStore documentStore, ContentDocumentMapper mapper) {
        this.documentStore = documentStore;
        this.mapper = mapper;
    }

    public List<ChapterView> listChapters() {
        return documentStore.findAll(CHAPTER_COLLECTION).stream()
                .map(mapper::toChapterView)
                .toList();
    }

    public Optional<ChapterView> getChapter(String slug) {
        return documentStore.findOne(CHAPTER_COLLECTION, Map.of(SLUG, slug))
                .map(mapper::toChapterView);
    }

    /**
     * Inserts a new chapter and returns its store id.
     *
     * @throws DuplicateSlugException if a chapter with the same slug exists
     */
    public String createChapter(ChapterInput input) {
        if (documentStore.findOne(CHAPTER_COLLECTION, Map.of(SLUG, input.slug())).isPresent()) {
            throw new DuplicateSlugException(input.slug());
        }
        String id;
        try {
            id = documentStore.insert(CHAPTER_COLLECTION, mapper.toDocument(input));
        } catch (DuplicateDocumentException e) {
            // Lost the race against a concurrent insert; the unique index caught it.
            throw new DuplicateSlugException(input.slug(), e);
        }
        log.info("Created chapter {} (id={})", input.slug(), id);
        return id;
    }
}
