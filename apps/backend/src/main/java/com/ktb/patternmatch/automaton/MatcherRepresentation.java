package com.ktb.patternmatch.automaton;

/**
 * 전이 테이블 표현 방식. 외부 계약은 동일하다.
 */
public enum MatcherRepresentation {

    /** 문자 → 자식 노드 HashMap. 유니코드 전체를 다룬다. */
    HASH {
        @Override
        public PatternMatcher newMatcher(DuplicatePatternPolicy policy) {
            return new AhoCorasickMatcher(policy);
        }
    },

    /** 0x00-0xFF 고정 알파벳, 인덱스 기반 노드 배열과 미리 계산한 goto 테이블. */
    ARRAY {
        @Override
        public PatternMatcher newMatcher(DuplicatePatternPolicy policy) {
            return new ArrayTableMatcher(policy);
        }
    };

    public abstract PatternMatcher newMatcher(DuplicatePatternPolicy policy);
}
