package com.kopo.livequiz.clock;

/**
 * 문제별 답변 제한시간을 서버가 직접 재는 타이머.
 * <p>
 * 방 코드 하나에 타이머는 최대 하나이며, 새로 예약하면 이전 예약은 취소된다.
 * 타이머는 업무 규칙을 모른다. 만료 시 {@link TimeoutHandler} 만 호출하고,
 * 실제 문제 넘김 여부는 호출된 쪽이 문제 인덱스로 판단한다.
 */
public interface QuestionClock {

    interface TimeoutHandler {
        /**
         * @param roomCode      방 코드
         * @param questionIndex 예약 당시의 문제 인덱스 (이미 지나간 문제면 무시해야 한다)
         */
        void onTimeout(String roomCode, int questionIndex);
    }

    void schedule(String roomCode, int questionIndex, long deadlineEpochMs, TimeoutHandler onTimeout);

    void stop(String roomCode);

    boolean isScheduled(String roomCode);
}
