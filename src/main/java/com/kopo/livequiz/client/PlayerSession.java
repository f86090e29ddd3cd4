package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.JoinRoomResponse;
import com.kopo.livequiz.dto.RoomStateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 플레이어 쪽 동기화. 답안 제출은 서버가 중복을 무시하므로 일시적 실패 시 재시도한다.
 */
public class PlayerSession extends RoomSession {

    private static final Logger logger = LoggerFactory.getLogger(PlayerSession.class);

    static final int MAX_SUBMIT_ATTEMPTS = 3;

    private String playerId;
    private Integer answeredQuestionIndex;

    public PlayerSession(RoomApiClient api, Clock clock) {
        super(api, clock);
    }

    public JoinRoomResponse join(String code, String playerName) {
        JoinRoomResponse response = api.joinRoom(code, playerName);
        this.roomCode = response.getRoomCode();
        this.playerId = response.getPlayerId();
        logger.info("방 참가: {} ({}), 상태 {}", roomCode, playerName, response.getStatus());
        return response;
    }

    @Override
    protected RoomStateResponse fetchState() {
        return api.fetchRoomState(roomCode, null);
    }

    /**
     * 마지막으로 관측한 문제에 답한다. 이미 답한 문제면 서버를 호출하지 않는다.
     */
    public synchronized RoomStateResponse submitAnswer(String choice) {
        requireRoom();
        RoomPoller current = currentPoller();
        Integer questionIndex = current == null ? null : current.getObservedQuestionIndex();
        if (questionIndex != null && questionIndex.equals(answeredQuestionIndex)) {
            logger.debug("이미 답한 문제: {}", questionIndex);
            return getLastState();
        }

        RoomApiException lastError = null;
        for (int attempt = 1; attempt <= MAX_SUBMIT_ATTEMPTS; attempt++) {
            try {
                RoomStateResponse state = api.submitAnswer(roomCode, playerId, choice, questionIndex);
                answeredQuestionIndex = questionIndex != null ? questionIndex : state.getCurrentQuestionIndex();
                return state;
            } catch (RoomApiException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                lastError = e;
                logger.warn("답안 제출 실패 ({}/{}), 재시도: {}", attempt, MAX_SUBMIT_ATTEMPTS, e.getMessage());
            }
        }
        throw lastError;
    }

    public String getPlayerId() {
        return playerId;
    }
}
