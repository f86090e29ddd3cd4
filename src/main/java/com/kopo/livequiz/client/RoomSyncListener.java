package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.RoomStateResponse;

/**
 * 폴링 결과를 UI 쪽에 알려주는 콜백. 모든 콜백은 폴러 스레드 하나에서 순서대로 호출된다.
 */
public interface RoomSyncListener {

    /** 매 폴링 성공마다. */
    default void onSnapshot(RoomStateResponse state) {
    }

    /**
     * 관측된 문제 인덱스가 바뀌었을 때. 로컬 카운트다운은 이미 windowSeconds 로 초기화된 상태다.
     */
    default void onQuestionStarted(RoomStateResponse state, int windowSeconds) {
    }

    default void onCountdownTick(int questionIndex, long remainingSeconds) {
    }

    /** 문제당 한 번만 호출된다. */
    default void onCountdownExpired(int questionIndex) {
    }

    default void onGameFinished(RoomStateResponse state) {
    }

    default void onPollFailure(RoomApiException error) {
    }
}
