package com.kopo.livequiz.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateQuizRequest {
    @Schema(description = "퀴즈 주제", example = "The French Revolution")
    private String prompt;
    @Schema(description = "문제 개수 (1~10)", example = "5")
    private Integer numQuestions;
    @Schema(description = "난이도", example = "Medium")
    private String difficulty;
}
