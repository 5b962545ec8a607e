package org.example.biolearn.controller;

import jakarta.validation.Valid;
import org.example.biolearn.model.OperationStatus;
import org.example.biolearn.model.QuizInput;
import org.example.biolearn.model.QuizView;
import org.example.biolearn.service.QuizQuestionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class QuizController {

    private final QuizQuestionService quizQuestionService;

    public QuizController(QuizQuestionService quizQuestionService) {
        this.quizQuestionService = quizQuestionService;
    }

    @GetMapping("/chapters/{slug}/quiz")
    public List<QuizView> getQuizForChapter(
            @PathVariable String slug,
            @RequestParam(required = false) Integer limit) {
        return quizQuestionService.getQuizForChapter(slug, limit);
    }

    @PostMapping("/quiz")
    public OperationStatus createQuizItem(@Valid @RequestBody QuizInput request) {
        quizQuestionService.createQuizItem(request);
        return OperationStatus.ok();
    }
}
