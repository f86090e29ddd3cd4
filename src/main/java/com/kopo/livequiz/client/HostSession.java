package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.CreateRoomRequest;
import com.kopo.livequiz.dto.CreateRoomResponse;
import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 호스트 쪽 동기화. 호스트 토큰으로 폴링하므로 정답이 포함된 스냅샷을 받는다.
 * <p>
 * clientDrivenAdvance 가 켜져 있으면 로컬 카운트다운이 0 이 될 때 호스트가 직접 다음 문제로 넘긴다.
 * 서버 타이머(quiz.timer.enabled)가 꺼진 서버에서만 켠다.
 */
public class HostSession extends RoomSession {

    private static final Logger logger = LoggerFactory.getLogger(HostSession.class);

    private final boolean clientDrivenAdvance;
    private String hostId;
    // 자동 진행을 이미 요청한 문제 인덱스. 폴러 스레드와 호스트 스레드가 같이 본다
    private final AtomicReference<Integer> autoAdvancedIndex = new AtomicReference<>();

    public HostSession(RoomApiClient api, Clock clock, boolean clientDrivenAdvance) {
        super(api, clock);
        this.clientDrivenAdvance = clientDrivenAdvance;
    }

    public CreateRoomResponse createRoom(String hostName, String prompt, int numQuestions, String difficulty) {
        CreateRoomRequest request = new CreateRoomRequest();
        request.setHostName(hostName);
        request.setPrompt(prompt);
        request.setNumQuestions(numQuestions);
        request.setDifficulty(difficulty);
        CreateRoomResponse response = api.createRoom(request);
        attach(response.getRoomCode(), response.getHostId());
        logger.info("방 생성: {} (\"{}\", {}문제)", roomCode, response.getQuiz().getQuizTitle(), response.getQuiz().size());
        return response;
    }

    /**
     * 이미 만든 방에 다시 붙는다 (새로고침 등).
     */
    public void attach(String code, String hostId) {
        this.roomCode = code;
        this.hostId = hostId;
    }

    @Override
    protected RoomStateResponse fetchState() {
        return api.fetchRoomState(roomCode, hostId);
    }

    public RoomStateResponse start() {
        requireRoom();
        return api.startRoom(roomCode, hostId);
    }

    /**
     * 다음 문제로 넘긴다. 멱등이 아니므로 실패해도 재시도하지 않는다.
     * 실제로 넘어갔는지는 다음 폴링 결과로 확인한다.
     */
    public RoomStateResponse advance() {
        requireRoom();
        return api.advanceRoom(roomCode, hostId);
    }

    @Override
    protected RoomSyncListener decorate(RoomSyncListener listener) {
        if (!clientDrivenAdvance) {
            return listener;
        }
        return new RoomSyncListener() {
            @Override
            public void onSnapshot(RoomStateResponse state) {
                listener.onSnapshot(state);
            }

            @Override
            public void onQuestionStarted(RoomStateResponse state, int windowSeconds) {
                listener.onQuestionStarted(state, windowSeconds);
            }

            @Override
            public void onCountdownTick(int questionIndex, long remainingSeconds) {
                listener.onCountdownTick(questionIndex, remainingSeconds);
            }

            @Override
            public void onCountdownExpired(int questionIndex) {
                listener.onCountdownExpired(questionIndex);
                advanceAfterExpiry(questionIndex);
            }

            @Override
            public void onGameFinished(RoomStateResponse state) {
                listener.onGameFinished(state);
            }

            @Override
            public void onPollFailure(RoomApiException error) {
                listener.onPollFailure(error);
            }
        };
    }

    /**
     * 만료된 문제가 서버에서도 아직 현재 문제일 때만 한 번 넘긴다.
     */
    boolean advanceAfterExpiry(int questionIndex) {
        Integer previous = autoAdvancedIndex.get();
        if ((previous != null && previous == questionIndex) || !autoAdvancedIndex.compareAndSet(previous, questionIndex)) {
            return false;
        }
        try {
            RoomStateResponse fresh = fetchState();
            if (fresh.getStatus() != Room.RoomStatus.IN_PROGRESS
                    || fresh.getCurrentQuestionIndex() == null
                    || fresh.getCurrentQuestionIndex() != questionIndex) {
                logger.debug("자동 진행 생략: 서버는 이미 문제 {} ({})", fresh.getCurrentQuestionIndex(), fresh.getStatus());
                return false;
            }
            advance();
            logger.info("제한시간 만료로 다음 문제 요청: 룸 {}, 문제 {}", roomCode, questionIndex + 1);
            return true;
        } catch (RoomApiException e) {
            logger.warn("자동 진행 실패 (재시도 안 함): 룸 {}, 문제 {} - {}", roomCode, questionIndex + 1, e.getMessage());
            return false;
        }
    }

    public String getHostId() {
        return hostId;
    }
}
