package com.kopo.livequiz.entity;

import lombok.Data;
import java.time.Instant;

@Data
public class Player {
    private String id;
    private String name;
    private int score = 0;
    private boolean answeredCurrent = false;
    // 이 인덱스 이전의 문제에는 답할 수 없다 (진행 중 참가자)
    private int firstEligibleQuestionIndex = 0;
    private Instant joinedAt;
}
