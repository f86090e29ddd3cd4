package com.kopo.livequiz.service;

import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.entity.QuizQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * API 키가 없거나 Gemini 호출이 실패했을 때 쓰는 테스트용 문제.
 * 홀수 번호는 4지선다, 짝수 번호는 O/X 문제이며 정답은 항상 첫 번째 보기다.
 */
@Component
public class MockQuizFactory {

    private static final Logger logger = LoggerFactory.getLogger(MockQuizFactory.class);

    public Quiz createQuiz(String topic, int count) {
        logger.info("Mock 문제 {}개 생성", count);
        List<QuizQuestion> questions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            questions.add(createQuestion(topic, i + 1));
        }
        return new Quiz("Mock Quiz: " + displayTopic(topic), questions);
    }

    public QuizQuestion createQuestion(String topic, int number) {
        if (number % 2 == 1) {
            List<String> choices = List.of("First choice", "Second choice", "Third choice", "Fourth choice");
            return new QuizQuestion(
                    "Mock question " + number + " about " + displayTopic(topic) + ": which choice is correct?",
                    choices,
                    choices.get(0));
        }
        List<String> choices = List.of("True", "False");
        return new QuizQuestion(
                "Mock question " + number + ": this statement about " + displayTopic(topic) + " is true.",
                choices,
                choices.get(0));
    }

    private static String displayTopic(String topic) {
        return topic == null || topic.isBlank() ? "general knowledge" : topic.trim();
    }
}
