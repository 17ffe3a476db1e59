package com.ktb.patternmatch.exception;

public class AutomatonNotBuiltException extends PatternMatchException {

    public AutomatonNotBuiltException() {
        super("오토마톤이 아직 빌드되지 않았습니다. build()를 먼저 호출하세요.");
    }
}
