package com.ktb.patternmatch.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchRequest {

    /** 파이프/공백으로 구분한 패턴 목록 */
    @Schema(description = "파이프(|) 또는 공백으로 구분한 패턴 목록", example = "cat|dog")
    @NotNull
    private String patterns;

    @Schema(description = "검색할 텍스트", example = "the cat scaty on the dog")
    @NotNull
    private String text;

    @Schema(description = "발생 위치 포함 여부")
    private boolean withPositions;
}
