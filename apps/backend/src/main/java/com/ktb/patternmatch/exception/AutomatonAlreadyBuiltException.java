package com.ktb.patternmatch.exception;

public class AutomatonAlreadyBuiltException extends PatternMatchException {

    public AutomatonAlreadyBuiltException(String operation) {
        super("이미 빌드된 오토마톤에는 " + operation + "을(를) 호출할 수 없습니다.");
    }
}
