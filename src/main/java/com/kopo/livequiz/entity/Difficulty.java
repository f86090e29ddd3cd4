package com.kopo.livequiz.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 퀴즈 난이도. 문제당 답변 제한시간(answer window)을 결정한다.
 */
public enum Difficulty {
    EASY("Easy", 15),
    MEDIUM("Medium", 20),
    HARD("Hard", 20);

    private final String label;
    private final int answerWindowSeconds;

    Difficulty(String label, int answerWindowSeconds) {
        this.label = label;
        this.answerWindowSeconds = answerWindowSeconds;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getAnswerWindowSeconds() {
        return answerWindowSeconds;
    }

    public long getAnswerWindowMillis() {
        return answerWindowSeconds * 1000L;
    }

    /**
     * "Easy", "easy", "EASY" 모두 허용. 값이 없으면 Medium.
     */
    @JsonCreator
    public static Difficulty from(String value) {
        if (value == null || value.trim().isEmpty()) {
            return MEDIUM;
        }
        String normalized = value.trim();
        for (Difficulty difficulty : values()) {
            if (difficulty.label.equalsIgnoreCase(normalized)) {
                return difficulty;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + value + " (expected Easy, Medium or Hard)");
    }

    @Override
    public String toString() {
        return label;
    }
}
