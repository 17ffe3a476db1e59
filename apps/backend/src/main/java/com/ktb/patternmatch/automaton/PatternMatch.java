package com.ktb.patternmatch.automaton;

/**
 * 텍스트 안의 패턴 발생 하나.
 *
 * @param pattern 매칭된 패턴
 * @param start   시작 인덱스 (포함)
 * @param end     끝 인덱스 (미포함)
 */
public record PatternMatch(String pattern, int start, int end) {

    static PatternMatch endingAt(String pattern, int end) {
        return new PatternMatch(pattern, end - pattern.length(), end);
    }
}
