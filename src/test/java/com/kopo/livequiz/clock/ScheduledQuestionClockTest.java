package com.kopo.livequiz.clock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledQuestionClockTest {

    private ScheduledThreadPoolExecutor executor;
    private ScheduledQuestionClock questionClock;
    private final Clock clock = Clock.systemUTC();

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(1);
        executor.setRemoveOnCancelPolicy(true);
        questionClock = new ScheduledQuestionClock(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void firesOnceAtDeadline() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        List<String> calls = new CopyOnWriteArrayList<>();

        questionClock.schedule("ROOM01", 0, clock.millis() + 50, (code, index) -> {
            calls.add(code + "#" + index);
            fired.countDown();
        });

        assertThat(questionClock.isScheduled("ROOM01")).isTrue();
        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(calls).containsExactly("ROOM01#0");
        assertThat(questionClock.isScheduled("ROOM01")).isFalse();
    }

    @Test
    void reschedulingReplacesPreviousTimer() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        List<Integer> indexes = new CopyOnWriteArrayList<>();

        questionClock.schedule("ROOM01", 0, clock.millis() + 100, (code, index) -> indexes.add(index));
        questionClock.schedule("ROOM01", 1, clock.millis() + 150, (code, index) -> {
            indexes.add(index);
            fired.countDown();
        });

        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(indexes).containsExactly(1);
    }

    @Test
    void stoppedTimerNeverFires() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);

        questionClock.schedule("ROOM01", 0, clock.millis() + 100, (code, index) -> fired.countDown());
        questionClock.stop("ROOM01");

        assertThat(questionClock.isScheduled("ROOM01")).isFalse();
        assertThat(fired.await(300, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void handlerFailureDoesNotKillScheduler() throws Exception {
        CountDownLatch second = new CountDownLatch(1);

        questionClock.schedule("ROOM01", 0, clock.millis(), (code, index) -> {
            throw new IllegalStateException("boom");
        });
        questionClock.schedule("ROOM02", 0, clock.millis() + 50, (code, index) -> second.countDown());

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
