package com.kopo.livequiz.service;

import com.kopo.livequiz.entity.Quiz;

/**
 * 외부 문제 생성기. 방 상태를 전혀 모르는 동기 호출이며,
 * 요청한 개수와 정확히 같은 수의 문제를 돌려줘야 한다.
 */
public interface QuizSource {

    Quiz generate(QuizRequest request);
}
