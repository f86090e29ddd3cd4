package com.kopo.livequiz.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Room;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import java.util.ArrayList;
import java.util.List;

/**
 * 클라이언트가 주기적으로 가져가는 방 스냅샷.
 * 필드 이름은 기존 프론트엔드와 맞춰져 있으므로 바꾸지 않는다.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(name = "RoomState", description = "폴링용 방 상태 스냅샷")
public class RoomStateResponse {
    @Schema(description = "방 코드", example = "AB12CD")
    private String roomCode;
    @Schema(description = "방 상태", example = "in_progress")
    private Room.RoomStatus status;
    private String quizTitle;
    @Schema(description = "난이도", example = "Easy")
    private Difficulty difficulty;
    @Schema(description = "현재 문제 인덱스 (대기 중이면 null)", nullable = true)
    private Integer currentQuestionIndex;
    private int questionCount;
    private List<PlayerState> players = new ArrayList<>();
    @Schema(description = "진행 중일 때만 채워지는 현재 문제", nullable = true)
    private ActiveQuestion question;

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PlayerState {
        private String playerId;
        private String name;
        private int score;
        private boolean hasAnsweredCurrent;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ActiveQuestion {
        private int questionIndex;
        private int questionNumber;
        private String question;
        private List<String> choices;
        private int totalQuestions;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @Schema(description = "문제당 제한시간(초)")
        private Integer answerWindowSeconds;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @Schema(description = "서버 기준 마감 시각 (epoch ms)")
        private Long deadlineEpochMs;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @Schema(description = "정답 (호스트 뷰에서만 포함)")
        private String correctAnswer;
    }
}
