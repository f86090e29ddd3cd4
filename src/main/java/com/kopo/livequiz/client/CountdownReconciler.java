package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Room;

import java.util.Objects;

/**
 * 클라이언트 로컬 카운트다운을 서버 스냅샷에 맞춘다.
 * <p>
 * 규칙은 하나다. 관측한 current_question_index 가 바뀌면 로컬 타이머를 그 방 난이도의 전체 제한시간으로 다시 시작한다.
 * 인덱스가 바뀐 뒤에는 이전 카운트다운 값을 절대 이어 쓰지 않는다. 시계의 주인은 서버다.
 */
public class CountdownReconciler {

    public enum Change {
        NONE,
        STARTED,
        QUESTION_CHANGED,
        FINISHED
    }

    private Room.RoomStatus observedStatus;
    private Integer observedIndex;
    private int windowSeconds;
    private long localDeadlineMs = -1;

    public synchronized Change reconcile(RoomStateResponse state, long nowMs) {
        Room.RoomStatus status = state.getStatus();
        Integer index = state.getCurrentQuestionIndex();
        Change change = Change.NONE;

        if (status == Room.RoomStatus.FINISHED) {
            if (observedStatus != Room.RoomStatus.FINISHED) {
                change = Change.FINISHED;
            }
            localDeadlineMs = -1;
        } else if (status == Room.RoomStatus.IN_PROGRESS && index != null
                && (observedStatus != Room.RoomStatus.IN_PROGRESS || !Objects.equals(index, observedIndex))) {
            windowSeconds = state.getDifficulty().getAnswerWindowSeconds();
            localDeadlineMs = nowMs + windowSeconds * 1000L;
            change = observedStatus == Room.RoomStatus.IN_PROGRESS ? Change.QUESTION_CHANGED : Change.STARTED;
        }

        observedStatus = status;
        observedIndex = index;
        return change;
    }

    /**
     * 남은 초 (올림). 진행 중인 문제가 없으면 0.
     */
    public synchronized long remainingSeconds(long nowMs) {
        if (localDeadlineMs < 0) {
            return 0;
        }
        long remainingMs = localDeadlineMs - nowMs;
        return remainingMs <= 0 ? 0 : (remainingMs + 999) / 1000;
    }

    public synchronized boolean isCounting() {
        return localDeadlineMs >= 0;
    }

    public synchronized Integer getObservedIndex() {
        return observedIndex;
    }

    public synchronized Room.RoomStatus getObservedStatus() {
        return observedStatus;
    }

    public synchronized int getWindowSeconds() {
        return windowSeconds;
    }
}
