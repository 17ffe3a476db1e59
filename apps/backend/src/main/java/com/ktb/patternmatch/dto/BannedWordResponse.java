package com.ktb.patternmatch.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BannedWordResponse {

    private boolean success;

    /** 금칙어 포함 여부 */
    private boolean banned;

    /** 발견된 금칙어 (중복 제거, 처음 발견된 순서) */
    private List<String> words;
}
