package com.ktb.patternmatch.automaton;

/**
 * 같은 패턴이 두 번 이상 삽입됐을 때의 처리 방식.
 */
public enum DuplicatePatternPolicy {
    /** 삽입한 횟수만큼 저장하고, 발생 하나당 그 횟수만큼 보고한다. */
    PRESERVE,
    /** 두 번째 삽입부터는 무시한다. */
    IGNORE
}
