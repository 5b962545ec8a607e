package org.example.biolearn.controller;

import org.example.biolearn.repository.StoreUnavailableException;
import org.example.biolearn.service.SeedResult;
import org.example.biolearn.service.SeedService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SeedController.class)
class SeedControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SeedService seedService;

    @Test
    void seed_emptyStore_reportsSeeded() throws Exception {
        when(seedService.seed()).thenReturn(SeedResult.SEEDED);

        mockMvc.perform(post("/seed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.message", is("Seeded")));
    }

    @Test
    void seed_existingContent_reportsAlreadySeeded() throws Exception {
        when(seedService.seed()).thenReturn(SeedResult.ALREADY_SEEDED);

        mockMvc.perform(post("/seed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", is("Already seeded")));
    }

    @Test
    void seed_storeFailure_returns500() throws Exception {
        when(seedService.seed()).thenThrow(new StoreUnavailableException("Failed to read chapter: timed out"));

        mockMvc.perform(post("/seed"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail", is("Failed to read chapter: timed out")));
    }
}
