package com.ktb.patternmatch.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BannedWordRequest {

    @Schema(description = "검사할 메시지", example = "this is spam")
    @NotNull
    private String text;
}
