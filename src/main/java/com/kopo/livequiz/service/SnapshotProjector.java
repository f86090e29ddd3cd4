package com.kopo.livequiz.service;

import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.entity.Player;
import com.kopo.livequiz.entity.QuizQuestion;
import com.kopo.livequiz.entity.Room;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Room 을 보는 사람에 맞는 공개 스냅샷으로 바꾼다.
 * <p>
 * 부수효과가 없고 Room 만으로 계산된다. 호출하는 쪽이 방의 읽기 락을 잡고 있어야 한다.
 * 정답은 {@link ViewerRole#HOST} 뷰에만 들어간다.
 */
@Component
public class SnapshotProjector {

    public RoomStateResponse project(Room room, ViewerRole viewerRole) {
        RoomStateResponse state = new RoomStateResponse();
        state.setRoomCode(room.getCode());
        state.setStatus(room.getStatus());
        state.setQuizTitle(room.getQuiz().getQuizTitle());
        state.setDifficulty(room.getDifficulty());
        state.setCurrentQuestionIndex(room.getCurrentQuestionIndex());
        state.setQuestionCount(room.getQuestionCount());

        boolean inProgress = room.getStatus() == Room.RoomStatus.IN_PROGRESS;

        List<RoomStateResponse.PlayerState> players = new ArrayList<>(room.getPlayers().size());
        for (Player player : room.getPlayers().values()) {
            RoomStateResponse.PlayerState playerState = new RoomStateResponse.PlayerState();
            playerState.setPlayerId(player.getId());
            playerState.setName(player.getName());
            playerState.setScore(player.getScore());
            playerState.setHasAnsweredCurrent(inProgress && player.isAnsweredCurrent());
            players.add(playerState);
        }
        state.setPlayers(players);

        if (inProgress && room.getCurrentQuestionIndex() != null) {
            state.setQuestion(projectQuestion(room, viewerRole));
        }
        return state;
    }

    private RoomStateResponse.ActiveQuestion projectQuestion(Room room, ViewerRole viewerRole) {
        int index = room.getCurrentQuestionIndex();
        QuizQuestion current = room.getCurrentQuestion();

        RoomStateResponse.ActiveQuestion question = new RoomStateResponse.ActiveQuestion();
        question.setQuestionIndex(index);
        question.setQuestionNumber(index + 1);
        question.setQuestion(current.getQuestion());
        question.setChoices(List.copyOf(current.getChoices()));
        question.setTotalQuestions(room.getQuestionCount());
        question.setAnswerWindowSeconds(room.getDifficulty().getAnswerWindowSeconds());
        question.setDeadlineEpochMs(room.getQuestionDeadlineEpochMs());
        if (viewerRole == ViewerRole.HOST) {
            question.setCorrectAnswer(current.getAnswer());
        }
        return question;
    }
}
