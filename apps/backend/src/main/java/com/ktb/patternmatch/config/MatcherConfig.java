package com.ktb.patternmatch.config;

import com.ktb.patternmatch.util.BannedWordChecker;
import java.util.LinkedHashSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MatcherConfig {

    /**
     * matcher.banned-words 가 설정된 경우에만 금칙어 검사기를 등록한다.
     */
    @Bean
    @ConditionalOnProperty(name = "matcher.banned-words[0]")
    public BannedWordChecker bannedWordChecker(MatcherProperties properties) {
        BannedWordChecker checker = new BannedWordChecker(new LinkedHashSet<>(properties.getBannedWords()));
        log.info("BannedWordChecker initialized with {} words", checker.size());
        return checker;
    }
}
