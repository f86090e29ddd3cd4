package com.kopo.livequiz.clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link QuestionClock} 기본 구현. 공용 스케줄 스레드풀에 방마다 1회성 작업을 예약한다.
 */
@Component
public class ScheduledQuestionClock implements QuestionClock {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledQuestionClock.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    // roomCode -> 예약된 작업
    private final ConcurrentMap<String, ArmedTimer> activeTimers = new ConcurrentHashMap<>();

    public ScheduledQuestionClock(@Qualifier("questionClockScheduler") ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void schedule(String roomCode, int questionIndex, long deadlineEpochMs, TimeoutHandler onTimeout) {
        stop(roomCode);
        long delayMs = Math.max(0, deadlineEpochMs - clock.millis());
        ScheduledFuture<?> future = scheduler.schedule(
                () -> fire(roomCode, questionIndex, onTimeout),
                delayMs,
                TimeUnit.MILLISECONDS);
        activeTimers.put(roomCode, new ArmedTimer(questionIndex, future));
        logger.debug("문제 타이머 예약: 룸 {}, 문제 {}, {}ms 후 만료", roomCode, questionIndex, delayMs);
    }

    @Override
    public void stop(String roomCode) {
        ArmedTimer armed = activeTimers.remove(roomCode);
        if (armed != null) {
            // 실행 중인 콜백은 끊지 않는다
            armed.future.cancel(false);
            logger.debug("문제 타이머 해제: 룸 {}, 문제 {}", roomCode, armed.questionIndex);
        }
    }

    @Override
    public boolean isScheduled(String roomCode) {
        return activeTimers.containsKey(roomCode);
    }

    private void fire(String roomCode, int questionIndex, TimeoutHandler onTimeout) {
        activeTimers.computeIfPresent(roomCode, (code, armed) -> armed.questionIndex == questionIndex ? null : armed);
        logger.info("문제 제한시간 만료: 룸 {}, 문제 {}", roomCode, questionIndex);
        try {
            onTimeout.onTimeout(roomCode, questionIndex);
        } catch (RuntimeException e) {
            // 스케줄러 스레드 밖으로는 던질 곳이 없다
            logger.error("타임아웃 처리 중 오류: 룸 {}, 문제 {}: {}", roomCode, questionIndex, e.getMessage(), e);
        }
    }

    private static final class ArmedTimer {
        private final int questionIndex;
        private final ScheduledFuture<?> future;

        private ArmedTimer(int questionIndex, ScheduledFuture<?> future) {
            this.questionIndex = questionIndex;
            this.future = future;
        }
    }
}
