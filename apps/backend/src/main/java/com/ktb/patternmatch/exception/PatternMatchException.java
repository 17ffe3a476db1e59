package com.ktb.patternmatch.exception;

/**
 * 패턴 매칭 오토마톤에서 발생하는 모든 예외의 상위 타입.
 */
public class PatternMatchException extends RuntimeException {

    public PatternMatchException(String message) {
        super(message);
    }
}
