package com.ktb.patternmatch.config;

import com.ktb.patternmatch.service.PatternMatchService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 기동 시 예제 패턴으로 한 번 매칭해서 결과를 로그로 남긴다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "matcher.example.enabled", havingValue = "true")
@RequiredArgsConstructor
public class PatternMatchExampleRunner implements CommandLineRunner {

    private final PatternMatchService patternMatchService;
    private final MatcherProperties properties;

    @Override
    public void run(String... args) {
        MatcherProperties.Example example = properties.getExample();
        List<String> matches = patternMatchService.matchWithAhoCorasick(example.getPatterns(), example.getText());
        log.info("예제 매칭 - patterns: '{}', text: '{}', matches: {}",
                example.getPatterns(), example.getText(), matches);
    }
}
