package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 고정 간격으로 방 스냅샷을 다시 받아오고, 1초마다 로컬 카운트다운을 흘려보낸다.
 * <p>
 * 서버는 이벤트를 보내지 않으므로 상태 변화는 최대 한 폴링 간격만큼 늦게 보인다.
 * 일시적인 조회 실패는 다음 주기에 다시 시도하고, 방이 사라졌거나 게임이 끝나면 폴링을 멈춘다.
 */
public class RoomPoller implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RoomPoller.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    private static final Duration TICK_INTERVAL = Duration.ofSeconds(1);

    @FunctionalInterface
    public interface SnapshotFetcher {
        RoomStateResponse fetch();
    }

    private final String roomCode;
    private final SnapshotFetcher fetcher;
    private final RoomSyncListener listener;
    private final Clock clock;
    private final Duration pollInterval;
    private final CountdownReconciler reconciler = new CountdownReconciler();

    private ScheduledExecutorService executor;
    private RoomStateResponse lastState;
    private Integer expiredNotifiedIndex;
    private int consecutiveFailures;
    private boolean stopped;

    public RoomPoller(String roomCode, SnapshotFetcher fetcher, RoomSyncListener listener, Clock clock, Duration pollInterval) {
        this.roomCode = roomCode;
        this.fetcher = fetcher;
        this.listener = listener;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        stopped = false;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "room-poller-" + roomCode);
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::pollSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(this::tickSafely, TICK_INTERVAL.toMillis(), TICK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("폴링 시작: 룸 {}, 간격 {}ms", roomCode, pollInterval.toMillis());
    }

    /**
     * 스냅샷 한 번 조회 후 카운트다운을 맞춘다. 실패하면 null.
     * <p>
     * 리스너는 폴러 락을 놓은 뒤에 호출한다. 리스너가 세션을 다시 부르거나 다른 스레드가 세션을 닫아도 락 순서가 엇갈리지 않는다.
     */
    public RoomStateResponse pollOnce() {
        if (isStopped()) {
            return null;
        }
        RoomStateResponse state;
        try {
            state = fetcher.fetch();
        } catch (RoomApiException e) {
            int failures;
            synchronized (this) {
                failures = ++consecutiveFailures;
            }
            listener.onPollFailure(e);
            if (e.isTransient()) {
                logger.warn("방 상태 조회 실패 ({}회 연속), 다음 주기에 재시도: 룸 {} - {}", failures, roomCode, e.getMessage());
            } else {
                logger.warn("방 상태 조회 불가, 폴링 중단: 룸 {} - {} {}", roomCode, e.getStatus(), e.getMessage());
                stop();
            }
            return null;
        }

        CountdownReconciler.Change change;
        int windowSeconds;
        synchronized (this) {
            if (stopped) {
                return null;
            }
            consecutiveFailures = 0;
            lastState = state;
            change = reconciler.reconcile(state, clock.millis());
            windowSeconds = reconciler.getWindowSeconds();
        }

        listener.onSnapshot(state);
        switch (change) {
            case STARTED:
            case QUESTION_CHANGED:
                logger.debug("문제 변경 관측: 룸 {}, 문제 {}", roomCode, state.getCurrentQuestionIndex());
                listener.onQuestionStarted(state, windowSeconds);
                break;
            case FINISHED:
                logger.info("게임 종료 관측: 룸 {}", roomCode);
                listener.onGameFinished(state);
                stop();
                break;
            default:
                break;
        }
        return state;
    }

    /**
     * 로컬 카운트다운 한 칸. 문제당 만료 알림은 한 번뿐이다.
     */
    public void tickOnce() {
        int index;
        long remaining;
        boolean expired = false;
        synchronized (this) {
            if (stopped || lastState == null || lastState.getStatus() != Room.RoomStatus.IN_PROGRESS || !reconciler.isCounting()) {
                return;
            }
            index = reconciler.getObservedIndex();
            remaining = reconciler.remainingSeconds(clock.millis());
            if (remaining == 0 && (expiredNotifiedIndex == null || expiredNotifiedIndex != index)) {
                expiredNotifiedIndex = index;
                expired = true;
            }
        }
        listener.onCountdownTick(index, remaining);
        if (expired) {
            listener.onCountdownExpired(index);
        }
    }

    public synchronized RoomStateResponse getLastState() {
        return lastState;
    }

    public synchronized Integer getObservedQuestionIndex() {
        return reconciler.getObservedIndex();
    }

    public synchronized long remainingSeconds() {
        return reconciler.remainingSeconds(clock.millis());
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    public synchronized void stop() {
        stopped = true;
        if (executor != null) {
            executor.shutdown();
            executor = null;
            logger.info("폴링 중단: 룸 {}", roomCode);
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            // 리스너 오류로 스케줄이 죽지 않게 한다
            logger.error("폴링 처리 중 오류: 룸 {} - {}", roomCode, e.getMessage(), e);
        }
    }

    private void tickSafely() {
        try {
            tickOnce();
        } catch (RuntimeException e) {
            logger.error("카운트다운 처리 중 오류: 룸 {} - {}", roomCode, e.getMessage(), e);
        }
    }
}
