package com.ktb.patternmatch.config;

import com.ktb.patternmatch.automaton.DuplicatePatternPolicy;
import com.ktb.patternmatch.automaton.MatcherRepresentation;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "matcher")
public class MatcherProperties {

    /** 기본 전이 테이블 표현 */
    private MatcherRepresentation representation = MatcherRepresentation.HASH;

    /** 중복 패턴 처리 방식 */
    private DuplicatePatternPolicy duplicatePolicy = DuplicatePatternPolicy.PRESERVE;

    private Cache cache = new Cache();

    private Example example = new Example();

    /** 금칙어 목록 */
    private List<String> bannedWords = new ArrayList<>();

    @Data
    public static class Cache {
        /** 빌드된 오토마톤 캐시 최대 개수 (0 이면 캐시 안 함) */
        private int maxEntries = 256;
    }

    @Data
    public static class Example {
        private boolean enabled = false;
        private String patterns = "cat|dog";
        private String text = "the cat scaty on the dog";
    }
}
