package com.kopo.livequiz.service;

import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.exception.QuizGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * 요청 값을 정리해 {@link QuizSource} 를 호출한다. 방 생성 전에 퀴즈를 딱 한 번 만든다.
 */
@Service
public class QuizGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(QuizGenerationService.class);

    public static final String DEFAULT_PROMPT = "The French Revolution";
    public static final int DEFAULT_NUM_QUESTIONS = 5;
    public static final int MAX_NUM_QUESTIONS = 10;

    @Autowired
    private QuizSource quizSource;

    @Autowired
    private PdfTextExtractor pdfTextExtractor;

    public Quiz generateQuiz(String prompt, Integer numQuestions, Difficulty difficulty) {
        return generateQuiz(prompt, numQuestions, difficulty, null);
    }

    public Quiz generateQuiz(String prompt, Integer numQuestions, Difficulty difficulty, MultipartFile pdf) {
        int count = numQuestions == null ? DEFAULT_NUM_QUESTIONS : numQuestions;
        if (count < 1 || count > MAX_NUM_QUESTIONS) {
            throw new IllegalArgumentException("num_questions must be between 1 and " + MAX_NUM_QUESTIONS);
        }
        String topic = prompt == null || prompt.isBlank() ? DEFAULT_PROMPT : prompt.trim();

        String sourceText = null;
        if (pdf != null && !pdf.isEmpty()) {
            sourceText = pdfTextExtractor.extract(pdf);
        }

        logger.info("=== 퀴즈 생성 서비스 호출 ===");
        logger.info("주제: {}, 문제 개수: {}, 난이도: {}, PDF: {}",
                topic, count, difficulty, pdf == null ? "없음" : pdf.getOriginalFilename());

        Quiz quiz = quizSource.generate(new QuizRequest(topic, sourceText, count, difficulty));
        if (quiz == null || quiz.size() != count) {
            throw new QuizGenerationException("Quiz source returned " + (quiz == null ? 0 : quiz.size())
                    + " questions, expected " + count);
        }
        logger.info("퀴즈 생성 완료: {}개", quiz.size());
        return quiz;
    }
}
