package com.kopo.livequiz.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 게임 시작 / 다음 문제 요청. 호스트 토큰 하나만 받는다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostActionRequest {
    @Schema(description = "방 생성 시 발급된 호스트 토큰", required = true)
    private String hostId;
}
