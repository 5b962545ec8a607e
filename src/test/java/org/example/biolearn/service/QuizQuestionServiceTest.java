package org.example.biolearn.service;

import org.bson.types.ObjectId;
import org.example.biolearn.config.ContentApiProperties;
import org.example.biolearn.model.QuizInput;
import org.example.biolearn.model.QuizView;
import org.example.biolearn.repository.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuizQuestionServiceTest {

    @Mock
    private DocumentStore documentStore;

    private ContentApiProperties properties;
    private QuizQuestionService quizQuestionService;

    @BeforeEach
    void setUp() {
        properties = new ContentApiProperties();
        quizQuestionService = new QuizQuestionService(documentStore, new ContentDocumentMapper(), properties);
    }

    @Test
    void getQuizUsesConfiguredDefaultLimit() {
        properties.getQuiz().setDefaultLimit(20);
        when(documentStore.findMany("quizquestion", Map.of("chapter_slug", "cell-structure"), 20))
                .thenReturn(List.of(quizDocument("cell-structure", 1)));

        List<QuizView> quiz = quizQuestionService.getQuizForChapter("cell-structure", null);

        assertEquals(1, quiz.size());
        assertEquals(1, quiz.get(0).correctIndex());
    }

    @Test
    void getQuizPassesExplicitLimitThrough() {
        when(documentStore.findMany("quizquestion", Map.of("chapter_slug", "cell-structure"), 1))
                .thenReturn(List.of(quizDocument("cell-structure", 0)));

        assertEquals(1, quizQuestionService.getQuizForChapter("cell-structure", 1).size());
    }

    @Test
    void getQuizWithZeroLimitAsksStoreForEverything() {
        when(documentStore.findMany("quizquestion", Map.of("chapter_slug", "cell-structure"), 0))
                .thenReturn(List.of(quizDocument("cell-structure", 0), quizDocument("cell-structure", 1)));

        assertEquals(2, quizQuestionService.getQuizForChapter("cell-structure", 0).size());
    }

    @Test
    void getQuizForUnknownChapterIsEmpty() {
        when(documentStore.findMany("quizquestion", Map.of("chapter_slug", "nope"), 20)).thenReturn(List.of());

        assertTrue(quizQuestionService.getQuizForChapter("nope", null).isEmpty());
        verify(documentStore, never()).findOne(eq("chapter"), anyMap());
    }

    @Test
    void getQuizRejectsNegativeLimit() {
        InvalidContentException ex = assertThrows(InvalidContentException.class,
                () -> quizQuestionService.getQuizForChapter("cell-structure", -1));

        assertEquals("limit must not be negative", ex.getMessage());
        verifyNoInteractions(documentStore);
    }

    @Test
    void createQuizItemRejectsIndexEqualToOptionCount() {
        QuizInput input = new QuizInput("x", "Q?", List.of("a", "b"), 2, "Because.", null);

        InvalidContentException ex = assertThrows(InvalidContentException.class,
                () -> quizQuestionService.createQuizItem(input));

        assertEquals("correct_index out of range", ex.getMessage());
        verifyNoInteractions(documentStore);
    }

    @Test
    void createQuizItemRejectsNegativeIndex() {
        QuizInput input = new QuizInput("x", "Q?", List.of("a", "b"), -1, "Because.", null);

        assertThrows(InvalidContentException.class, () -> quizQuestionService.createQuizItem(input));
        verifyNoInteractions(documentStore);
    }

    @Test
    void createQuizItemRejectsSingleOption() {
        QuizInput input = new QuizInput("x", "Q?", List.of("a"), 0, "Because.", null);

        InvalidContentException ex = assertThrows(InvalidContentException.class,
                () -> quizQuestionService.createQuizItem(input));

        assertEquals("options must contain at least 2 entries", ex.getMessage());
    }

    @Test
    void createQuizItemStoresValidQuestionWithDefaultDifficulty() {
        when(documentStore.insert(eq("quizquestion"), anyMap())).thenReturn("65f0c0ffee0000000000beef");

        String id = quizQuestionService.createQuizItem(new QuizInput("x", "Q?", List.of("a", "b"), 1, "Because.", null));

        assertEquals("65f0c0ffee0000000000beef", id);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(documentStore).insert(eq("quizquestion"), captor.capture());
        assertEquals("OSN-N", captor.getValue().get("difficulty"));
        assertEquals(1, captor.getValue().get("correct_index"));
    }

    private Map<String, Object> quizDocument(String chapterSlug, int correctIndex) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("_id", new ObjectId());
        document.put("chapter_slug", chapterSlug);
        document.put("question", "Q?");
        document.put("options", List.of("a", "b", "c"));
        document.put("correct_index", correctIndex);
        document.put("explanation", "Because.");
        document.put("difficulty", "OSN-N");
        return document;
    }
}
