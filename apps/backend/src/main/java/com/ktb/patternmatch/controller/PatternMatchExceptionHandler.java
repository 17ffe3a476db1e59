package com.ktb.patternmatch.controller;

import com.ktb.patternmatch.dto.ErrorResponse;
import com.ktb.patternmatch.exception.InvalidPatternException;
import com.ktb.patternmatch.exception.PatternMatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = PatternMatchController.class)
public class PatternMatchExceptionHandler {

    @ExceptionHandler(InvalidPatternException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPattern(InvalidPatternException e) {
        log.warn("잘못된 패턴 '{}': {}", e.getPattern(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(false, e.getMessage()));
    }

    @ExceptionHandler(PatternMatchException.class)
    public ResponseEntity<ErrorResponse> handleAutomatonState(PatternMatchException e) {
        log.warn("오토마톤 상태 오류: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(false, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("요청 값이 올바르지 않습니다.");
        log.warn("요청 검증 실패: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(false, message));
    }
}
