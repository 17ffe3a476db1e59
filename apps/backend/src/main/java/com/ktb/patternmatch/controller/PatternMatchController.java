package com.ktb.patternmatch.controller;

import com.ktb.patternmatch.config.MatcherProperties;
import com.ktb.patternmatch.dto.BannedWordRequest;
import com.ktb.patternmatch.dto.BannedWordResponse;
import com.ktb.patternmatch.dto.ErrorResponse;
import com.ktb.patternmatch.dto.HealthResponse;
import com.ktb.patternmatch.dto.MatchRequest;
import com.ktb.patternmatch.dto.MatchResponse;
import com.ktb.patternmatch.service.MatchResult;
import com.ktb.patternmatch.service.PatternMatchService;
import com.ktb.patternmatch.util.BannedWordChecker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "패턴 매칭 (Match)", description = "Aho-Corasick 다중 패턴 매칭 API")
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/match")
public class PatternMatchController {

    private final PatternMatchService patternMatchService;
    private final MatcherProperties matcherProperties;
    private final ObjectProvider<BannedWordChecker> bannedWordChecker;

    @Operation(summary = "매칭 서비스 헬스체크", description = "현재 매처 설정을 함께 반환합니다.")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> healthCheck() {
        HealthResponse healthResponse = HealthResponse.builder()
                .success(true)
                .representation(matcherProperties.getRepresentation().name())
                .duplicatePolicy(matcherProperties.getDuplicatePolicy().name())
                .build();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache().mustRevalidate())
                .body(healthResponse);
    }

    @Operation(summary = "다중 패턴 매칭", description = "텍스트를 한 번 스캔해 모든 패턴 발생(겹침 포함)을 스캔 순서대로 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "매칭 성공", content = @Content(schema = @Schema(implementation = MatchResponse.class))),
            @ApiResponse(responseCode = "400", description = "유효하지 않은 요청 또는 패턴"),
            @ApiResponse(responseCode = "409", description = "오토마톤 상태 오류")
    })
    @PostMapping
    public ResponseEntity<MatchResponse> match(@Valid @RequestBody MatchRequest request) {
        MatchResult result = patternMatchService.match(
                request.getPatterns(), request.getText(), request.isWithPositions());

        log.debug("매칭 요청 처리 - patterns: {}, matches: {}",
                result.getPatterns().size(), result.getMatches().size());

        return ResponseEntity.ok(MatchResponse.from(result));
    }

    @Operation(summary = "금칙어 검사", description = "matcher.banned-words 로 설정된 금칙어가 메시지에 포함되어 있는지 검사합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검사 성공", content = @Content(schema = @Schema(implementation = BannedWordResponse.class))),
            @ApiResponse(responseCode = "400", description = "유효하지 않은 요청"),
            @ApiResponse(responseCode = "404", description = "금칙어가 설정되지 않음")
    })
    @PostMapping("/banned")
    public ResponseEntity<?> checkBannedWords(@Valid @RequestBody BannedWordRequest request) {
        BannedWordChecker checker = bannedWordChecker.getIfAvailable();
        if (checker == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse(false, "금칙어 목록이 설정되지 않았습니다."));
        }

        List<String> words = checker.findBannedWords(request.getText());
        if (!words.isEmpty()) {
            log.info("금칙어 감지 - count: {}", words.size());
        }

        return ResponseEntity.ok(BannedWordResponse.builder()
                .success(true)
                .banned(!words.isEmpty())
                .words(words)
                .build());
    }
}
