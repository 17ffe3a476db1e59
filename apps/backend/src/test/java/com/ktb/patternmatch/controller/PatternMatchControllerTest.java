package com.ktb.patternmatch.controller;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ktb.patternmatch.config.MatcherProperties;
import com.ktb.patternmatch.exception.AutomatonNotBuiltException;
import com.ktb.patternmatch.exception.InvalidPatternException;
import com.ktb.patternmatch.service.MatchResult;
import com.ktb.patternmatch.service.PatternMatchService;
import com.ktb.patternmatch.util.BannedWordChecker;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PatternMatchController.class)
class PatternMatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PatternMatchService patternMatchService;

    @MockBean
    private MatcherProperties matcherProperties;

    @MockBean
    private BannedWordChecker bannedWordChecker;

    @Test
    void returnsMatches() throws Exception {
        given(patternMatchService.match("cat|dog", "the cat", false))
                .willReturn(MatchResult.builder()
                        .patterns(List.of("cat", "dog"))
                        .matches(List.of("cat"))
                        .build());

        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patterns\":\"cat|dog\",\"text\":\"the cat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.matches", contains("cat")))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.positions").doesNotExist());
    }

    @Test
    void rejectsMissingText() throws Exception {
        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patterns\":\"cat\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void mapsInvalidPatternToBadRequest() throws Exception {
        given(patternMatchService.match(anyString(), anyString(), anyBoolean()))
                .willThrow(new InvalidPatternException("한", "지원하지 않는 문자"));

        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patterns\":\"한\",\"text\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("지원하지 않는 문자"));
    }

    @Test
    void mapsAutomatonStateErrorsToConflict() throws Exception {
        given(patternMatchService.match(anyString(), anyString(), anyBoolean()))
                .willThrow(new AutomatonNotBuiltException());

        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patterns\":\"cat\",\"text\":\"x\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void reportsHealth() throws Exception {
        given(matcherProperties.getRepresentation())
                .willReturn(com.ktb.patternmatch.automaton.MatcherRepresentation.ARRAY);
        given(matcherProperties.getDuplicatePolicy())
                .willReturn(com.ktb.patternmatch.automaton.DuplicatePatternPolicy.IGNORE);

        mockMvc.perform(get("/api/match/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.representation").value("ARRAY"))
                .andExpect(jsonPath("$.duplicatePolicy").value("IGNORE"));
    }

    @Test
    void reportsBannedWordsInMessage() throws Exception {
        given(bannedWordChecker.findBannedWords("this is SPAM and scam"))
                .willReturn(List.of("spam", "scam"));

        mockMvc.perform(post("/api/match/banned")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"this is SPAM and scam\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.banned").value(true))
                .andExpect(jsonPath("$.words", contains("spam", "scam")));
    }

    @Test
    void cleanMessageIsNotBanned() throws Exception {
        given(bannedWordChecker.findBannedWords(anyString())).willReturn(List.of());

        mockMvc.perform(post("/api/match/banned")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.banned").value(false))
                .andExpect(jsonPath("$.words").isEmpty());
    }

    @Test
    void rejectsBannedWordRequestWithoutText() throws Exception {
        mockMvc.perform(post("/api/match/banned")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
