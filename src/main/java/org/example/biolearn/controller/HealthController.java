package org.example.biolearn.controller;

import org.example.biolearn.model.StatusReport;
import org.example.biolearn.service.StoreStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    static final String WELCOME_MESSAGE = "Biology Learning API running";

    private final StoreStatusService storeStatusService;

    public HealthController(StoreStatusService storeStatusService) {
        this.storeStatusService = storeStatusService;
    }

    @GetMapping("/")
    public Welcome root() {
        return new Welcome(WELCOME_MESSAGE);
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    /**
     * Store diagnostics. Always answers 200; connectivity problems are described in the body.
     */
    @GetMapping("/test")
    public StatusReport storeStatus() {
        return storeStatusService.report();
    }

    public record Welcome(String message) {}

    public record Health(String status) {}
}
