package com.ktb.patternmatch.util;

import com.ktb.patternmatch.automaton.AhoCorasickMatcher;
import com.ktb.patternmatch.automaton.DuplicatePatternPolicy;
import com.ktb.patternmatch.automaton.PatternMatcher;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.util.Assert;

public class BannedWordChecker {

    private final PatternMatcher matcher;

    public BannedWordChecker(Set<String> bannedWords) {
        Assert.notNull(bannedWords, "Banned words set must not be null");

        // bannedWords 정규화
        Set<String> normalized = bannedWords.stream()
                .filter(word -> word != null && !word.isBlank())
                .map(word -> word.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Assert.notEmpty(normalized, "Banned words set must not be empty");

        // 핵심: Aho-Corasick 매처 생성
        this.matcher = new AhoCorasickMatcher(DuplicatePatternPolicy.IGNORE);
        this.matcher.addPatterns(normalized);
        this.matcher.build();
    }

    /** 금칙어 포함 여부 검사 */
    public boolean containsBannedWord(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        return matcher.contains(message.toLowerCase(Locale.ROOT));
    }

    /** 메시지에 들어있는 금칙어 (중복 제거, 처음 발견된 순서) */
    public List<String> findBannedWords(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        return matcher.match(message.toLowerCase(Locale.ROOT)).stream()
                .distinct()
                .toList();
    }

    public int size() {
        return matcher.patternCount();
    }
}
