package com.kopo.livequiz.service;

import com.kopo.livequiz.clock.QuestionClock;
import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Player;
import com.kopo.livequiz.entity.Room;
import com.kopo.livequiz.exception.EmptyRoomException;
import com.kopo.livequiz.exception.ForbiddenException;
import com.kopo.livequiz.exception.InvalidTransitionException;
import com.kopo.livequiz.exception.RoomNotFoundException;
import com.kopo.livequiz.exception.UnknownPlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 방 상태 전이: waiting → in_progress → finished.
 * <p>
 * 각 작업은 방의 쓰기 락 안에서 "검증 후 반영" 순서로 실행되므로,
 * 예외가 나면 방 상태는 조금도 바뀌지 않는다.
 * 문제 제한시간은 서버 타이머({@link QuestionClock})가 재고, 만료되면 {@link #advanceOnTimeout(String, int)} 가 호출된다.
 */
@Service
public class RoomSessionService {

    private static final Logger logger = LoggerFactory.getLogger(RoomSessionService.class);

    private final RoomRegistry roomRegistry;
    private final ScoringPolicy scoringPolicy;
    private final SnapshotProjector projector;
    private final QuestionClock questionClock;
    private final Clock clock;
    private final boolean timerEnabled;

    public RoomSessionService(RoomRegistry roomRegistry,
                              ScoringPolicy scoringPolicy,
                              SnapshotProjector projector,
                              QuestionClock questionClock,
                              Clock clock,
                              @Value("${quiz.timer.enabled:true}") boolean timerEnabled) {
        this.roomRegistry = roomRegistry;
        this.scoringPolicy = scoringPolicy;
        this.projector = projector;
        this.questionClock = questionClock;
        this.clock = clock;
        this.timerEnabled = timerEnabled;
    }

    public RoomStateResponse start(String code, String hostId) {
        Room room = roomRegistry.requireRoom(code);
        return room.withWriteLock(() -> {
            if (!room.isHost(hostId)) {
                logger.warn("호스트가 아닌 사용자가 게임 시작 시도: 룸 {}", room.getCode());
                throw new ForbiddenException(room.getCode());
            }
            if (room.getStatus() != Room.RoomStatus.WAITING) {
                throw new InvalidTransitionException(room.getCode(), "This room has already been started.");
            }
            if (room.getPlayers().isEmpty()) {
                throw new EmptyRoomException(room.getCode());
            }

            room.setStatus(Room.RoomStatus.IN_PROGRESS);
            activateQuestion(room, 0);

            logger.info("게임 시작됨: 룸 {} (참가자 {}명, 문제 {}개)",
                    room.getCode(), room.getPlayers().size(), room.getQuestionCount());
            return projector.project(room, ViewerRole.HOST);
        });
    }

    /**
     * 호스트가 다음 문제로 넘긴다. 멱등이 아니므로 두 번 호출하면 두 번 넘어간다.
     */
    public RoomStateResponse advance(String code, String hostId) {
        Room room = roomRegistry.requireRoom(code);
        return room.withWriteLock(() -> {
            if (!room.isHost(hostId)) {
                logger.warn("호스트가 아닌 사용자가 다음 문제 요청: 룸 {}", room.getCode());
                throw new ForbiddenException(room.getCode());
            }
            if (room.getStatus() != Room.RoomStatus.IN_PROGRESS) {
                throw new InvalidTransitionException(room.getCode(),
                        "Cannot advance questions when the game is not in progress.");
            }
            moveToNextQuestion(room, "host");
            return projector.project(room, ViewerRole.HOST);
        });
    }

    /**
     * 서버 타이머 만료 시 호출된다. 방이 아직 같은 문제에 머물러 있을 때만 넘긴다.
     *
     * @return 실제로 문제를 넘겼으면 true
     */
    public boolean advanceOnTimeout(String code, int expectedQuestionIndex) {
        Room room;
        try {
            room = roomRegistry.requireRoom(code);
        } catch (RoomNotFoundException e) {
            logger.debug("타임아웃 무시: 룸 {} 이미 정리됨", code);
            return false;
        }
        return room.withWriteLock(() -> {
            Integer current = room.getCurrentQuestionIndex();
            if (room.getStatus() != Room.RoomStatus.IN_PROGRESS || current == null || current != expectedQuestionIndex) {
                logger.debug("지난 타이머 무시: 룸 {}, 예약 문제 {}, 현재 문제 {}, 상태 {}",
                        room.getCode(), expectedQuestionIndex, current, room.getStatus());
                return false;
            }
            moveToNextQuestion(room, "timer");
            return true;
        });
    }

    /**
     * 답안 제출. 같은 문제에 대한 두 번째 제출은 오류 없이 무시된다 (클라이언트 재시도 안전).
     *
     * @param questionIndex 클라이언트가 보고 있던 문제 인덱스, 없으면 null
     */
    public RoomStateResponse submitAnswer(String code, String playerId, String choice, Integer questionIndex) {
        if (choice == null) {
            throw new IllegalArgumentException("answer must not be null");
        }
        Room room = roomRegistry.requireRoom(code);
        return room.withWriteLock(() -> {
            if (room.getStatus() != Room.RoomStatus.IN_PROGRESS) {
                throw new InvalidTransitionException(room.getCode(),
                        "Answers can only be submitted while the game is in progress.");
            }
            Player player = playerId == null ? null : room.getPlayers().get(playerId);
            if (player == null) {
                throw new UnknownPlayerException(room.getCode(), playerId);
            }

            int current = room.getCurrentQuestionIndex();
            if (questionIndex != null && questionIndex != current) {
                throw new InvalidTransitionException(room.getCode(),
                        "Question " + (questionIndex + 1) + " is no longer active.");
            }
            if (current < player.getFirstEligibleQuestionIndex()) {
                throw new InvalidTransitionException(room.getCode(),
                        "Player joined after question " + (current + 1) + " started.");
            }
            if (room.getAnswerLedger().containsKey(player.getId())) {
                logger.debug("중복 제출 무시: 룸 {}, 문제 {}, 플레이어 {}", room.getCode(), current, player.getName());
                return projector.project(room, ViewerRole.PLAYER);
            }

            int delta = scoringPolicy.score(choice, room.getCurrentQuestion().getAnswer());
            room.getAnswerLedger().put(player.getId(), choice);
            player.setAnsweredCurrent(true);
            player.setScore(player.getScore() + delta);
            room.setLastActivityAt(clock.instant());

            logger.info("답안 제출: 룸 {}, 문제 {}, 플레이어 {}, 점수 +{} (총 {}점, 제출 {}/{})",
                    room.getCode(), current + 1, player.getName(), delta, player.getScore(),
                    room.getAnswerLedger().size(), room.getPlayers().size());
            return projector.project(room, ViewerRole.PLAYER);
        });
    }

    // 쓰기 락 안에서만 호출
    private void moveToNextQuestion(Room room, String trigger) {
        int leaving = room.getCurrentQuestionIndex();
        logger.info("문제 {} 마감 ({}): 룸 {}, 제출 {}/{}",
                leaving + 1, trigger, room.getCode(), room.getAnswerLedger().size(), room.getPlayers().size());

        if (room.isOnLastQuestion()) {
            room.setStatus(Room.RoomStatus.FINISHED);
            room.setFinishedAt(clock.instant());
            resetAnswers(room);
            room.setLastActivityAt(clock.instant());
            questionClock.stop(room.getCode());
            logger.info("퀴즈 종료: 룸 {}", room.getCode());
            return;
        }
        activateQuestion(room, leaving + 1);
        logger.info("문제 이동: {} -> {} (룸 {})", leaving + 1, leaving + 2, room.getCode());
    }

    // 쓰기 락 안에서만 호출
    private void activateQuestion(Room room, int index) {
        room.setCurrentQuestionIndex(index);
        resetAnswers(room);
        long now = clock.millis();
        room.setQuestionStartedAtEpochMs(now);
        room.setLastActivityAt(clock.instant());
        if (timerEnabled) {
            questionClock.schedule(room.getCode(), index, room.getQuestionDeadlineEpochMs(), this::onQuestionTimeout);
        }
    }

    private void onQuestionTimeout(String code, int questionIndex) {
        advanceOnTimeout(code, questionIndex);
    }

    private static void resetAnswers(Room room) {
        room.getAnswerLedger().clear();
        for (Player player : room.getPlayers().values()) {
            player.setAnsweredCurrent(false);
        }
    }
}
