package org.example.biolearn.controller;

import org.example.biolearn.model.OperationStatus;
import org.example.biolearn.service.SeedResult;
import org.example.biolearn.service.SeedService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SeedController {

    private final SeedService seedService;

    public SeedController(SeedService seedService) {
        this.seedService = seedService;
    }

    @PostMapping("/seed")
    public OperationStatus seed() {
        SeedResult result = seedService.seed();
        return OperationStatus.ok(result.message());
    }
}
