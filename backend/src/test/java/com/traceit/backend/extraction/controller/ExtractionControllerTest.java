package com.traceit.backend.extraction.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.traceit.backend.exception.GlobalExceptionHandler;
import com.traceit.backend.exception.UnsupportedInputException;
import com.traceit.backend.extraction.ExtractorRouter;
import com.traceit.backend.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ExtractionControllerTest {

    private static final String THREAD_URL = "https://www.reddit.com/r/aww/comments/kv8q8d/";

    @Mock
    private ExtractorRouter extractorRouter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ExtractionController(extractorRouter))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Returns the extracted content in its wire shape")
    void extract() throws Exception {
        when(extractorRouter.route(THREAD_URL)).thenReturn(Fixtures.redditPost(THREAD_URL));

        mockMvc.perform(post("/api/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \" " + THREAD_URL + " \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform").value("reddit"))
                .andExpect(jsonPath("$.url").value(THREAD_URL))
                .andExpect(jsonPath("$.title").value("My cat learned to open doors"))
                .andExpect(jsonPath("$.mediaRefs[0]").value("https://i.redd.it/door.jpg"));
    }

    @Test
    @DisplayName("No usable extractor is reported as unsupported input")
    void unsupported() throws Exception {
        when(extractorRouter.route("https://example.com/empty"))
                .thenThrow(new UnsupportedInputException("No suitable extractor found for URL: https://example.com/empty"));

        mockMvc.perform(post("/api/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com/empty\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("unsupported_input"));
    }
}
