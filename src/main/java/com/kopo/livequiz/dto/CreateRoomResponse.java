package com.kopo.livequiz.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kopo.livequiz.entity.Quiz;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 호스트에게만 한 번 내려가는 응답. quiz 에는 정답이 포함된다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateRoomResponse {
    private String roomCode;
    private String hostId;
    private Quiz quiz;
}
