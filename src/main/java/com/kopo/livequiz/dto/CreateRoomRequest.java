package com.kopo.livequiz.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "CreateRoomRequest", description = "방 생성 요청 데이터")
public class CreateRoomRequest {
    @Schema(description = "호스트 이름", example = "홍길동", required = true)
    private String hostName;
    @Schema(description = "퀴즈 주제", example = "The French Revolution")
    private String prompt;
    @Schema(description = "문제 개수 (1~10)", example = "5")
    private Integer numQuestions;
    @Schema(description = "난이도 (Easy, Medium, Hard)", example = "Medium")
    private String difficulty;
}
