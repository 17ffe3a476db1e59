package com.ktb.patternmatch.service;

import com.ktb.patternmatch.automaton.PatternMatch;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class MatchResult {
    private List<String> patterns;
    private List<String> matches;
    private List<PatternMatch> positions;
}
