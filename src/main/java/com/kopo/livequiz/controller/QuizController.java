package com.kopo.livequiz.controller;

import com.kopo.livequiz.dto.GenerateQuizRequest;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.service.QuizGenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 방 없이 혼자 푸는 모드에서 쓰는 퀴즈 생성 API.
 */
@RestController
@CrossOrigin(origins = "*")
@Tag(name = "Quiz", description = "퀴즈 생성 API")
public class QuizController {

    private static final Logger logger = LoggerFactory.getLogger(QuizController.class);

    @Autowired
    private QuizGenerationService quizGenerationService;

    @PostMapping({"/generate-quiz", "/generate-quiz/"})
    @Operation(summary = "퀴즈 생성", description = "주제, 문제 수, 난이도로 퀴즈를 생성합니다. 정답이 포함됩니다.")
    @ApiResponse(responseCode = "200", description = "생성 성공", content = @Content(schema = @Schema(implementation = Quiz.class)))
    @ApiResponse(responseCode = "502", description = "퀴즈 생성 실패")
    public ResponseEntity<Quiz> generateQuiz(@RequestBody GenerateQuizRequest request) {
        logger.info("=== 퀴즈 생성 API 호출 ===");
        logger.info("요청 데이터: {}", request);

        Quiz quiz = quizGenerationService.generateQuiz(
                request.getPrompt(), request.getNumQuestions(), Difficulty.from(request.getDifficulty()));
        return ResponseEntity.ok(quiz);
    }
}
