package com.kopo.livequiz.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 하나의 게임 세션에 대한 권위 있는 상태.
 * <p>
 * 모든 변경은 {@link #withWriteLock(Supplier)} 안에서, 모든 조회는 {@link #withReadLock(Supplier)} 안에서 수행한다.
 * 락은 방 단위이며 방끼리는 서로를 기다리지 않는다.
 */
@Getter
@Setter
public class Room {
    private final String code;
    private final String hostId;
    private final String hostName;
    private final Quiz quiz;
    private final Difficulty difficulty;
    private final Instant createdAt;

    private RoomStatus status = RoomStatus.WAITING;
    private Integer currentQuestionIndex;
    private long questionStartedAtEpochMs;
    private Instant finishedAt;
    private volatile Instant lastActivityAt;

    private final Map<String, Player> players = new LinkedHashMap<>();
    // 현재 문제에 대한 답안만 보관 (playerId -> 선택지)
    private final Map<String, String> answerLedger = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Room(String code, String hostId, String hostName, Quiz quiz, Difficulty difficulty, Instant createdAt) {
        this.code = code;
        this.hostId = hostId;
        this.hostName = hostName;
        this.quiz = quiz;
        this.difficulty = difficulty;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public <T> T withReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T withWriteLock(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isHost(String candidateHostId) {
        return candidateHostId != null && hostId.equals(candidateHostId);
    }

    public int getQuestionCount() {
        return quiz.size();
    }

    public boolean isOnLastQuestion() {
        return currentQuestionIndex != null && currentQuestionIndex >= quiz.size() - 1;
    }

    public QuizQuestion getCurrentQuestion() {
        if (currentQuestionIndex == null) {
            return null;
        }
        return quiz.getQuestions().get(currentQuestionIndex);
    }

    public long getQuestionDeadlineEpochMs() {
        return questionStartedAtEpochMs + difficulty.getAnswerWindowMillis();
    }

    public enum RoomStatus {
        WAITING("waiting"),
        IN_PROGRESS("in_progress"),
        FINISHED("finished");

        private final String value;

        RoomStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static RoomStatus from(String value) {
            for (RoomStatus status : values()) {
                if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown room status: " + value);
        }
    }
}
