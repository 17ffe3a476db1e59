package com.ktb.patternmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private boolean success;

    /** 기본 전이 테이블 표현 (HASH / ARRAY) */
    private String representation;

    private String duplicatePolicy;
}
