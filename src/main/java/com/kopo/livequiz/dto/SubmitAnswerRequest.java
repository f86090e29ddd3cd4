package com.kopo.livequiz.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "SubmitAnswerRequest", description = "답변 제출 요청 데이터")
public class SubmitAnswerRequest {
    @Schema(description = "참가 시 발급된 플레이어 토큰", required = true)
    private String playerId;
    @Schema(description = "선택한 보기 텍스트", required = true)
    private String answer;
    @Schema(description = "클라이언트가 보고 있는 문제 인덱스 (생략 가능)", nullable = true)
    private Integer questionIndex;
}
