package com.kopo.livequiz.service;

import com.kopo.livequiz.clock.QuestionClock;
import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Player;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.entity.QuizQuestion;
import com.kopo.livequiz.entity.Room;
import com.kopo.livequiz.exception.ForbiddenException;
import com.kopo.livequiz.exception.InvalidTransitionException;
import com.kopo.livequiz.exception.RoomNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 생성, 코드로 방 찾기, 참가, 스냅샷 조회, 방치된 방 정리.
 * <p>
 * 방 목록 자체는 {@link ConcurrentHashMap} 이고, 방 하나에 대한 변경은 그 방의 락 안에서만 일어난다.
 */
@Service
public class RoomRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private static final int MAX_CODE_ATTEMPTS = 50;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    private final RoomCodeGenerator codeGenerator;
    private final SnapshotProjector projector;
    private final QuestionClock questionClock;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration finishedRetention;

    public RoomRegistry(RoomCodeGenerator codeGenerator,
                        SnapshotProjector projector,
                        QuestionClock questionClock,
                        Clock clock,
                        @Value("${quiz.rooms.idle-timeout:2h}") Duration idleTimeout,
                        @Value("${quiz.rooms.finished-retention:30m}") Duration finishedRetention) {
        this.codeGenerator = codeGenerator;
        this.projector = projector;
        this.questionClock = questionClock;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
        this.finishedRetention = finishedRetention;
    }

    public Room createRoom(Quiz quiz, Difficulty difficulty, String hostName) {
        String trimmedHostName = requireName(hostName, "host_name");
        Quiz frozenQuiz = freeze(quiz);

        logger.info("=== 룸 생성 시작 ===");
        logger.info("호스트: {}", trimmedHostName);
        logger.info("퀴즈 제목: {}", frozenQuiz.getQuizTitle());
        logger.info("문제 개수: {}", frozenQuiz.size());
        logger.info("난이도: {} (문제당 {}초)", difficulty, difficulty.getAnswerWindowSeconds());

        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.generate();
            Room room = new Room(code, UUID.randomUUID().toString(), trimmedHostName, frozenQuiz, difficulty, clock.instant());
            if (rooms.putIfAbsent(code, room) == null) {
                logger.info("룸 생성 완료: {} (현재 룸 {}개)", code, rooms.size());
                return room;
            }
            logger.warn("방 코드 충돌, 다시 생성: {} ({}회차)", code, attempt);
        }
        throw new IllegalStateException("Could not allocate a unique room code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    public Player joinRoom(String code, String playerName) {
        String trimmedName = requireName(playerName, "player_name");
        Room room = requireRoom(code);
        return room.withWriteLock(() -> {
            if (room.getStatus() == Room.RoomStatus.FINISHED) {
                throw new InvalidTransitionException(room.getCode(), "This room has already finished.");
            }
            Player player = new Player();
            player.setId(UUID.randomUUID().toString());
            player.setName(trimmedName);
            player.setJoinedAt(clock.instant());
            if (room.getStatus() == Room.RoomStatus.IN_PROGRESS) {
                // 이미 시작된 문제에는 답할 수 없다
                player.setFirstEligibleQuestionIndex(room.getCurrentQuestionIndex() + 1);
            }
            room.getPlayers().put(player.getId(), player);
            room.setLastActivityAt(clock.instant());

            logger.info("참가자 추가 완료: {} (룸: {}, 상태: {}, 총 참가자: {}명)",
                    trimmedName, room.getCode(), room.getStatus(), room.getPlayers().size());
            return player;
        });
    }

    /**
     * 폴링용 조회. hostId 가 없으면 플레이어 뷰, 맞는 hostId 면 호스트 뷰.
     *
     * @throws ForbiddenException hostId 가 주어졌지만 이 방의 호스트가 아닐 때
     */
    public RoomStateResponse getRoomState(String code, String hostId) {
        Room room = requireRoom(code);
        ViewerRole viewerRole = ViewerRole.PLAYER;
        if (hostId != null && !hostId.isBlank()) {
            if (!room.isHost(hostId)) {
                throw new ForbiddenException(room.getCode());
            }
            viewerRole = ViewerRole.HOST;
        }
        return getSnapshot(room, viewerRole);
    }

    public RoomStateResponse getSnapshot(String code, ViewerRole viewerRole) {
        return getSnapshot(requireRoom(code), viewerRole);
    }

    private RoomStateResponse getSnapshot(Room room, ViewerRole viewerRole) {
        RoomStateResponse state = room.withReadLock(() -> projector.project(room, viewerRole));
        logger.debug("룸 스냅샷 조회: {} ({}, {})", room.getCode(), viewerRole, state.getStatus());
        return state;
    }

    public Room requireRoom(String code) {
        String normalized = RoomCodeGenerator.normalize(code);
        Room room = rooms.get(normalized);
        if (room == null) {
            logger.debug("룸 조회 실패: {} (존재하지 않음)", normalized);
            throw new RoomNotFoundException(normalized);
        }
        return room;
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * 오래 방치된 방과 끝난 지 오래된 방을 지운다.
     */
    @Scheduled(fixedDelayString = "${quiz.rooms.sweep-interval-ms:60000}")
    public void evictStaleRooms() {
        Instant now = clock.instant();
        List<String> evicted = new ArrayList<>();
        for (Room room : rooms.values()) {
            if (isStale(room, now) && rooms.remove(room.getCode(), room)) {
                questionClock.stop(room.getCode());
                evicted.add(room.getCode());
            }
        }
        if (!evicted.isEmpty()) {
            logger.info("방치된 룸 {}개 정리: {} (남은 룸 {}개)", evicted.size(), evicted, rooms.size());
        }
    }

    private boolean isStale(Room room, Instant now) {
        return room.withReadLock(() -> {
            if (room.getStatus() == Room.RoomStatus.FINISHED && room.getFinishedAt() != null
                    && room.getFinishedAt().plus(finishedRetention).isBefore(now)) {
                return true;
            }
            return room.getLastActivityAt().plus(idleTimeout).isBefore(now);
        });
    }

    private static String requireName(String name, String field) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return name.trim();
    }

    /**
     * 호출자가 넘긴 퀴즈를 검증하고 변경 불가능한 사본을 만든다.
     */
    private static Quiz freeze(Quiz quiz) {
        if (quiz == null || quiz.size() == 0) {
            throw new IllegalArgumentException("A room needs a quiz with at least one question");
        }
        List<QuizQuestion> questions = new ArrayList<>(quiz.size());
        for (QuizQuestion question : quiz.getQuestions()) {
            if (question.getChoices() == null || question.getChoices().isEmpty()
                    || !question.getChoices().contains(question.getAnswer())) {
                throw new IllegalArgumentException("Every question needs choices and an answer among them: " + question.getQuestion());
            }
            questions.add(new QuizQuestion(question.getQuestion(), List.copyOf(question.getChoices()), question.getAnswer()));
        }
        return new Quiz(quiz.getQuizTitle(), List.copyOf(questions));
    }
}
