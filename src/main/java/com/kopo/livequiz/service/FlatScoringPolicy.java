package com.kopo.livequiz.service;

import org.springframework.stereotype.Component;

/**
 * 기본 채점 규칙: 정답이면 1점, 아니면 0점.
 * 제출 값의 앞뒤 공백만 제거하고 대소문자는 구분한다.
 */
@Component
public class FlatScoringPolicy implements ScoringPolicy {

    @Override
    public int score(String choice, String correctAnswer) {
        if (choice == null || correctAnswer == null) {
            return 0;
        }
        return choice.trim().equals(correctAnswer) ? 1 : 0;
    }
}
