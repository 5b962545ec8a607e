package org.example.biolearn.controller;

import jakarta.validation.Valid;
import org.example.biolearn.model.ChapterInput;
import org.example.biolearn.model.ChapterView;
import org.example.biolearn.model.OperationStatus;
import org.example.biolearn.service.ChapterNotFoundException;
import org.example.biolearn.service.ChapterService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/chapters")
public class ChapterController {

    private final ChapterService chapterService;

    public ChapterController(ChapterService chapterService) {
        this.chapterService = chapterService;
    }

    @GetMapping
    public List<ChapterView> listChapters() {
        return chapterService.listChapters();
    }

    @GetMapping("/{slug}")
    public ChapterView getChapter(@PathVariable String slug) {
        return chapterService.getChapter(slug)
                .orElseThrow(() -> new ChapterNotFoundException(slug));
    }

    @PostMapping
    public OperationStatus createChapter(@Valid @RequestBody ChapterInput request) {
        chapterService.createChapter(request);
        return OperationStatus.ok();
    }
}
