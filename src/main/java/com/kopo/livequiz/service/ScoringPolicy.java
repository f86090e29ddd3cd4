package com.kopo.livequiz.service;

/**
 * 제출된 답과 정답으로 점수 변화량을 계산하는 순수 함수.
 * 플레이어/문제 쌍마다 최초 제출 시 정확히 한 번 호출된다.
 */
@FunctionalInterface
public interface ScoringPolicy {

    int score(String choice, String correctAnswer);
}
