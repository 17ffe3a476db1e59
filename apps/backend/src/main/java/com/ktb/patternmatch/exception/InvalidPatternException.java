package com.ktb.patternmatch.exception;

import lombok.Getter;

/**
 * 빈 패턴이거나 오토마톤이 표현할 수 없는 문자를 포함한 패턴.
 */
@Getter
public class InvalidPatternException extends PatternMatchException {

    private final String pattern;

    public InvalidPatternException(String pattern, String message) {
        super(message);
        this.pattern = pattern;
    }
}
