package com.ktb.patternmatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ktb.patternmatch.automaton.PatternMatch;
import com.ktb.patternmatch.service.MatchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResponse {

    private boolean success;

    private List<String> patterns;

    private List<String> matches;

    private int count;

    private List<PatternMatch> positions;

    public static MatchResponse from(MatchResult result) {
        return MatchResponse.builder()
                .success(true)
                .patterns(result.getPatterns())
                .matches(result.getMatches())
                .count(result.getMatches().size())
                .positions(result.getPositions())
                .build();
    }
}
