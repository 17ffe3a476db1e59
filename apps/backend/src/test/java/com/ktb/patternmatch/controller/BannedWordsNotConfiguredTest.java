package com.ktb.patternmatch.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ktb.patternmatch.config.MatcherProperties;
import com.ktb.patternmatch.service.PatternMatchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PatternMatchController.class)
class BannedWordsNotConfiguredTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PatternMatchService patternMatchService;

    @MockBean
    private MatcherProperties matcherProperties;

    @Test
    void returnsNotFoundWithoutBannedWordList() throws Exception {
        mockMvc.perform(post("/api/match/banned")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"spam\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }
}
