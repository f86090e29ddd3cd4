package com.kopo.livequiz.common;

import com.kopo.livequiz.dto.ErrorResponse;
import com.kopo.livequiz.exception.EmptyRoomException;
import com.kopo.livequiz.exception.ForbiddenException;
import com.kopo.livequiz.exception.InvalidTransitionException;
import com.kopo.livequiz.exception.QuizGenerationException;
import com.kopo.livequiz.exception.RoomException;
import com.kopo.livequiz.exception.RoomNotFoundException;
import com.kopo.livequiz.exception.UnknownPlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * 전역 예외 매핑.
 * <p>
 * 방 엔진 오류는 모두 동기적이고 재시도해도 결과가 같으므로 4xx 로 내려보낸다.
 */
@RestControllerAdvice
public class WebExceptionAdvice {

    private static final Logger logger = LoggerFactory.getLogger(WebExceptionAdvice.class);

    @ExceptionHandler(RoomException.class)
    public ResponseEntity<ErrorResponse> roomError(RoomException e) {
        HttpStatus status = statusOf(e);
        logger.warn("요청 거부 ({} {}): 룸 {} - {}", status.value(), e.getErrorName(), e.getRoomCode(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorName(), e.getMessage()));
    }

    /**
     * 입력값 오류 (이름 누락, 문제 수 범위, 알 수 없는 난이도 등).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        logger.warn("잘못된 요청: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("BadRequest", e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> unreadableRequest(Exception e) {
        logger.warn("요청 본문을 읽을 수 없음: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("BadRequest", "Malformed request: " + e.getMessage()));
    }

    @ExceptionHandler(QuizGenerationException.class)
    public ResponseEntity<ErrorResponse> quizGenerationFailed(QuizGenerationException e) {
        logger.error("퀴즈 생성 실패: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse("QuizGenerationFailed", e.getMessage()));
    }

    private static HttpStatus statusOf(RoomException e) {
        if (e instanceof RoomNotFoundException || e instanceof UnknownPlayerException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ForbiddenException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof InvalidTransitionException || e instanceof EmptyRoomException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
