package com.kopo.livequiz.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.entity.QuizQuestion;
import com.kopo.livequiz.exception.QuizGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini generateContent API 로 퀴즈를 만든다.
 * <p>
 * 응답 JSON 에서 형식이 맞지 않는 문제는 버리고, 모자라면 Mock 문제로 채우고, 넘치면 자른다.
 * API 키가 없거나 호출이 실패하면 설정에 따라 Mock 퀴즈로 대체하거나 {@link QuizGenerationException} 을 던진다.
 */
@Service
public class GeminiQuizSource implements QuizSource {

    private static final Logger logger = LoggerFactory.getLogger(GeminiQuizSource.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MockQuizFactory mockQuizFactory;
    private final String apiKey;
    private final String apiUrl;
    private final boolean fallbackToMock;

    public GeminiQuizSource(@Qualifier("geminiRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            MockQuizFactory mockQuizFactory,
                            @Value("${gemini.api.key:}") String apiKey,
                            @Value("${gemini.api.url:https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent}") String apiUrl,
                            @Value("${quiz.gemini.fallback-to-mock:true}") boolean fallbackToMock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.mockQuizFactory = mockQuizFactory;
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.fallbackToMock = fallbackToMock;
    }

    @Override
    public Quiz generate(QuizRequest request) {
        logger.info("=== Gemini API로 퀴즈 생성 시작 ===");
        logger.info("주제: {}", request.getPrompt());
        logger.info("문제 개수: {}, 난이도: {}", request.getNumQuestions(), request.getDifficulty());
        logger.info("첨부 본문 길이: {}자", request.getSourceText() == null ? 0 : request.getSourceText().length());

        if (apiKey == null || apiKey.isBlank()) {
            return fallback(request, "gemini.api.key is not configured", null);
        }

        try {
            String prompt = createPrompt(request);
            logger.debug("생성된 프롬프트: {}", prompt);

            String generatedContent = callGeminiApi(prompt);
            logger.info("Gemini API 응답 받음. 길이: {} 문자", generatedContent.length());
            logger.debug("Gemini 응답 내용: {}", generatedContent);

            Quiz quiz = parseQuiz(generatedContent, request);
            logger.info("퀴즈 생성 완료: \"{}\" {}개", quiz.getQuizTitle(), quiz.size());
            return quiz;
        } catch (RestClientException | QuizGenerationException e) {
            return fallback(request, e.getMessage(), e);
        }
    }

    private Quiz fallback(QuizRequest request, String reason, Exception cause) {
        if (!fallbackToMock) {
            logger.error("퀴즈 생성 실패: {}", reason);
            throw new QuizGenerationException("Quiz generation failed: " + reason, cause);
        }
        logger.warn("퀴즈 생성 실패, Mock 데이터로 폴백: {}", reason);
        return mockQuizFactory.createQuiz(request.getPrompt(), request.getNumQuestions());
    }

    private String callGeminiApi(String prompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        Map<String, Object> contents = new HashMap<>();
        contents.put("parts", List.of(part));
        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("responseMimeType", "application/json");
        generationConfig.put("temperature", 0.7);

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("contents", List.of(contents));
        requestBody.put("generationConfig", generationConfig);

        ResponseEntity<Map> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(requestBody, headers), Map.class);
        Map<String, Object> body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null) {
            throw new QuizGenerationException("Gemini API returned " + response.getStatusCode());
        }
        List<Map<String, Object>> candidates = (List<Map<String, Object>>) body.get("candidates");
        if (candidates != null && !candidates.isEmpty()) {
            Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
            List<Map<String, Object>> responseParts = content == null ? null : (List<Map<String, Object>>) content.get("parts");
            if (responseParts != null && !responseParts.isEmpty() && responseParts.get(0).get("text") != null) {
                return (String) responseParts.get(0).get("text");
            }
        }
        throw new QuizGenerationException("Gemini API response had no text candidate");
    }

    String createPrompt(QuizRequest request) {
        String source = request.getSourceText() == null || request.getSourceText().isBlank()
                ? "none"
                : request.getSourceText();
        return String.format(
                "You write quizzes for a live multiplayer trivia game. Questions should be fun, short and easy to read.%n" +
                "Rules:%n" +
                "- Generate exactly %d questions, no more and no fewer.%n" +
                "- Difficulty must be %s for every question.%n" +
                "- Each question has either 2 choices (true/false) or 4 distinct choices.%n" +
                "- The answer must be copied exactly from one of the choices.%n" +
                "- If source material is given below, base every question on it and ignore the topic.%n" +
                "Topic: \"%s\"%n" +
                "Source material: \"%s\"%n" +
                "Respond with JSON only, using this structure:%n" +
                "{\"quiz_title\": \"short title\", \"questions\": [{\"question\": \"text\", \"choices\": [\"A\", \"B\", \"C\", \"D\"], \"answer\": \"A\"}]}",
                request.getNumQuestions(),
                request.getDifficulty(),
                request.getPrompt(),
                source);
    }

    Quiz parseQuiz(String response, QuizRequest request) {
        // 마크다운 코드 블록 제거
        String json = response.replaceAll("```json", "").replaceAll("```", "").trim();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new QuizGenerationException("Gemini response was not valid JSON: " + e.getMessage(), e);
        }

        List<QuizQuestion> questions = new ArrayList<>();
        for (JsonNode node : root.path("questions")) {
            QuizQuestion question = toQuestion(node);
            if (question != null) {
                questions.add(question);
            }
        }
        if (questions.isEmpty()) {
            throw new QuizGenerationException("Gemini response contained no usable questions");
        }

        int expected = request.getNumQuestions();
        while (questions.size() < expected) {
            logger.warn("생성된 문제가 요청된 수({})보다 적어 Mock 문제로 보충합니다. (현재: {})", expected, questions.size());
            questions.add(mockQuizFactory.createQuestion(request.getPrompt(), questions.size() + 1));
        }
        if (questions.size() > expected) {
            questions = new ArrayList<>(questions.subList(0, expected));
        }

        String title = root.path("quiz_title").asText("").trim();
        if (title.isEmpty()) {
            title = "Quiz: " + request.getPrompt();
        }
        return new Quiz(title, questions);
    }

    private QuizQuestion toQuestion(JsonNode node) {
        String text = node.path("question").asText("").trim();
        List<String> choices = new ArrayList<>();
        for (JsonNode choiceNode : node.path("choices")) {
            String choice = choiceNode.asText("").trim();
            if (!choice.isEmpty() && !choices.contains(choice)) {
                choices.add(choice);
            }
        }
        if (text.isEmpty() || choices.size() < 2) {
            logger.warn("형식이 맞지 않는 문제 제외: {}", node);
            return null;
        }

        String answer = node.path("answer").asText("").trim();
        String matched = null;
        for (String choice : choices) {
            if (choice.equals(answer)) {
                matched = choice;
                break;
            }
            if (matched == null && choice.equalsIgnoreCase(answer)) {
                matched = choice;
            }
        }
        if (matched == null) {
            logger.warn("정답이 보기에 없는 문제 제외: {} (정답: {})", text, answer);
            return null;
        }
        return new QuizQuestion(text, choices, matched);
    }
}
