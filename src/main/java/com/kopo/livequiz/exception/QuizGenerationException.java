package com.kopo.livequiz.exception;

/**
 * 외부 문제 생성기(Gemini) 호출이 실패했고 Mock 폴백도 꺼져 있을 때.
 */
public class QuizGenerationException extends RuntimeException {

    public QuizGenerationException(String message) {
        super(message);
    }

    public QuizGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
