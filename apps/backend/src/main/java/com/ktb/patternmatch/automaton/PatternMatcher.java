package com.ktb.patternmatch.automaton;

import java.util.List;

/**
 * 다중 패턴 정확 매칭 오토마톤.
 * <p>
 * 사용 순서는 항상 {@code addPattern} (여러 번) → {@code build} (정확히 한 번) → {@code match} (여러 번)이다.
 * build 이후의 인스턴스는 불변이므로 여러 스레드에서 락 없이 동시에 매칭해도 된다.
 * build 이전에는 스레드 안전하지 않다.
 */
public interface PatternMatcher {

    /**
     * 패턴을 트라이에 삽입한다.
     *
     * @throws com.ktb.patternmatch.exception.InvalidPatternException 패턴이 null 이거나 비어있는 경우
     * @throws com.ktb.patternmatch.exception.AutomatonAlreadyBuiltException build 이후 호출된 경우
     */
    void addPattern(String pattern);

    default void addPatterns(Iterable<String> patterns) {
        for (String pattern : patterns) {
            addPattern(pattern);
        }
    }

    /**
     * 실패 링크를 BFS로 계산하고 출력 집합을 병합한 뒤 오토마톤을 동결한다.
     *
     * @throws com.ktb.patternmatch.exception.AutomatonAlreadyBuiltException 두 번째 호출인 경우
     */
    void build();

    /**
     * 텍스트를 한 번 스캔하며 발견한 패턴을 발견 순서대로 반환한다. 같은 패턴이 여러 번 나올 수 있다.
     *
     * @throws com.ktb.patternmatch.exception.AutomatonNotBuiltException build 이전에 호출된 경우
     */
    List<String> match(String text);

    /**
     * {@link #match(String)}와 같은 순서로, 각 발생 위치까지 함께 반환한다.
     */
    List<PatternMatch> matchWithPositions(String text);

    /** 첫 매칭에서 바로 반환한다. */
    boolean contains(String text);

    boolean isBuilt();

    int patternCount();
}
