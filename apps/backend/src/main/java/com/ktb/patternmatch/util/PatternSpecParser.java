package com.ktb.patternmatch.util;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * "cat|dog fish" 형태의 패턴 명세 문자열을 개별 패턴으로 나눈다.
 */
@UtilityClass
public class PatternSpecParser {

    // 유니코드 공백(U+3000, U+00A0 등)과 BOM 도 구분자로 본다
    private final Pattern DELIMITER = Pattern.compile("[|\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);

    /** 파이프/공백 기준으로 분리하고 빈 토큰은 버린다. 순서는 유지한다. */
    public List<String> parse(String spec) {
        if (spec == null) {
            return List.of();
        }
        return Arrays.stream(DELIMITER.split(spec))
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
