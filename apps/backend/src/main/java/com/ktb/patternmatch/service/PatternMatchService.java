package com.ktb.patternmatch.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ktb.patternmatch.automaton.DuplicatePatternPolicy;
import com.ktb.patternmatch.automaton.MatcherRepresentation;
import com.ktb.patternmatch.automaton.PatternMatch;
import com.ktb.patternmatch.automaton.PatternMatcher;
import com.ktb.patternmatch.config.MatcherProperties;
import com.ktb.patternmatch.util.PatternSpecParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class PatternMatchService {

    private final MatcherProperties properties;
    private final MeterRegistry meterRegistry;

    // 빌드가 끝난 오토마톤은 불변이므로 요청 간에 공유한다. max-entries 가 0 이하면 null
    private final Cache<MatcherKey, PatternMatcher> matcherCache;

    // ===== Metrics cache =====
    private final ConcurrentMap<String, Timer> matchTimers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> occurrenceCounters = new ConcurrentHashMap<>();

    public PatternMatchService(MatcherProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        int maxEntries = properties.getCache().getMaxEntries();
        if (maxEntries > 0) {
            this.matcherCache = Caffeine.newBuilder()
                    .maximumSize(maxEntries)
                    .recordStats()
                    .build();
            CaffeineCacheMetrics.monitor(meterRegistry, matcherCache, "pattern.matchers");
        } else {
            this.matcherCache = null;
        }
    }

    private Timer getMatchTimer(MatcherRepresentation representation) {
        return matchTimers.computeIfAbsent(representation.name(), k -> Timer.builder("pattern.match.time")
                .description("Aho-Corasick text scan time")
                .tags(Tags.of("representation", k))
                .register(meterRegistry));
    }

    private Counter getOccurrenceCounter(MatcherRepresentation representation) {
        return occurrenceCounters.computeIfAbsent(representation.name(), k -> Counter.builder("pattern.match.occurrences")
                .description("Pattern occurrences reported")
                .tag("representation", k)
                .register(meterRegistry));
    }

    /**
     * 패턴 명세를 분리해 오토마톤을 만들고 텍스트에서 매칭된 패턴을 반환한다.
     *
     * @param patternSpec 파이프/공백으로 구분한 패턴 목록 (예: "cat|dog")
     * @param text 검색할 텍스트
     */
    public List<String> matchWithAhoCorasick(String patternSpec, String text) {
        return match(patternSpec, text, false).getMatches();
    }

    public MatchResult match(String patternSpec, String text, boolean withPositions) {
        List<String> patterns = PatternSpecParser.parse(patternSpec);
        MatcherRepresentation representation = properties.getRepresentation();
        PatternMatcher matcher = compile(patterns, representation, properties.getDuplicatePolicy());

        Timer.Sample sample = Timer.start(meterRegistry);
        List<String> matches;
        List<PatternMatch> positions = null;
        if (withPositions) {
            // 한 번만 스캔하고 패턴 목록은 위치 결과에서 뽑는다
            positions = matcher.matchWithPositions(text);
            matches = positions.stream().map(PatternMatch::pattern).toList();
        } else {
            matches = matcher.match(text);
        }
        sample.stop(getMatchTimer(representation));
        getOccurrenceCounter(representation).increment(matches.size());

        log.debug("매칭 완료 - patterns: {}, textLength: {}, matches: {}",
                patterns.size(), text == null ? 0 : text.length(), matches.size());

        return MatchResult.builder()
                .patterns(patterns)
                .matches(matches)
                .positions(positions)
                .build();
    }

    /**
     * 패턴 목록으로 빌드된 오토마톤을 반환한다. 같은 조합이면 캐시된 인스턴스를 재사용한다.
     */
    public PatternMatcher compile(List<String> patterns,
                                  MatcherRepresentation representation,
                                  DuplicatePatternPolicy duplicatePolicy) {
        if (matcherCache == null) {
            return newMatcher(patterns, representation, duplicatePolicy);
        }

        MatcherKey key = new MatcherKey(List.copyOf(patterns), representation, duplicatePolicy);
        return matcherCache.get(key, k -> {
            log.debug("matcher cache MISS: {} patterns", k.patterns().size());
            return newMatcher(k.patterns(), k.representation(), k.duplicatePolicy());
        });
    }

    long cachedMatcherCount() {
        if (matcherCache == null) {
            return 0;
        }
        matcherCache.cleanUp();
        return matcherCache.estimatedSize();
    }

    private PatternMatcher newMatcher(List<String> patterns,
                                      MatcherRepresentation representation,
                                      DuplicatePatternPolicy duplicatePolicy) {
        PatternMatcher matcher = representation.newMatcher(duplicatePolicy);
        matcher.addPatterns(patterns);
        matcher.build();
        return matcher;
    }

    private record MatcherKey(List<String> patterns,
                              MatcherRepresentation representation,
                              DuplicatePatternPolicy duplicatePolicy) {
    }
}
