package com.kopo.livequiz.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.exception.QuizGenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiQuizSourceTest {

    private static final String API_URL = "http://gemini.test/generate";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private GeminiQuizSource source(String apiKey, boolean fallbackToMock) {
        return new GeminiQuizSource(restTemplate, objectMapper, new MockQuizFactory(), apiKey, API_URL, fallbackToMock);
    }

    private String candidate(String text) throws Exception {
        Map<String, Object> body = Map.of("candidates",
                List.of(Map.of("content", Map.of("parts", List.of(Map.of("text", text))))));
        return objectMapper.writeValueAsString(body);
    }

    @Test
    void parsesGeneratedQuizAndSendsApiKey() throws Exception {
        String quizJson = "```json\n{\"quiz_title\": \"Revolution\", \"questions\": ["
                + "{\"question\": \"When did it start?\", \"choices\": [\"1789\", \"1815\", \"1848\", \"1914\"], \"answer\": \"1789\"},"
                + "{\"question\": \"Bastille was stormed.\", \"choices\": [\"True\", \"False\"], \"answer\": \"true\"}"
                + "]}\n```";
        server.expect(requestTo(API_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "secret"))
                .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
                .andRespond(withSuccess(candidate(quizJson), MediaType.APPLICATION_JSON));

        Quiz quiz = source("secret", false).generate(new QuizRequest("French Revolution", null, 2, Difficulty.EASY));

        server.verify();
        assertThat(quiz.getQuizTitle()).isEqualTo("Revolution");
        assertThat(quiz.getQuestions()).hasSize(2);
        assertThat(quiz.getQuestions().get(1).getAnswer()).isEqualTo("True");
    }

    @Test
    void dropsMalformedQuestionsAndPadsToRequestedCount() throws Exception {
        String quizJson = "{\"questions\": ["
                + "{\"question\": \"Only one choice\", \"choices\": [\"A\"], \"answer\": \"A\"},"
                + "{\"question\": \"Answer missing\", \"choices\": [\"A\", \"B\"], \"answer\": \"C\"},"
                + "{\"question\": \"Good one\", \"choices\": [\"A\", \"B\"], \"answer\": \"B\"}"
                + "]}";
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess(candidate(quizJson), MediaType.APPLICATION_JSON));

        Quiz quiz = source("secret", false).generate(new QuizRequest("Letters", null, 3, Difficulty.MEDIUM));

        assertThat(quiz.getQuizTitle()).isEqualTo("Quiz: Letters");
        assertThat(quiz.getQuestions()).hasSize(3);
        assertThat(quiz.getQuestions().get(0).getQuestion()).isEqualTo("Good one");
        assertThat(quiz.getQuestions()).allMatch(q -> q.getChoices().contains(q.getAnswer()));
    }

    @Test
    void trimsExtraQuestions() throws Exception {
        String quizJson = "{\"quiz_title\": \"T\", \"questions\": ["
                + "{\"question\": \"Q1\", \"choices\": [\"A\", \"B\"], \"answer\": \"A\"},"
                + "{\"question\": \"Q2\", \"choices\": [\"A\", \"B\"], \"answer\": \"A\"}"
                + "]}";
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess(candidate(quizJson), MediaType.APPLICATION_JSON));

        Quiz quiz = source("secret", false).generate(new QuizRequest("T", null, 1, Difficulty.HARD));

        assertThat(quiz.getQuestions()).extracting("question").containsExactly("Q1");
    }

    @Test
    void fallsBackToMockQuizWhenApiFails() {
        server.expect(requestTo(API_URL)).andRespond(withServerError());

        Quiz quiz = source("secret", true).generate(new QuizRequest("Space", null, 4, Difficulty.EASY));

        assertThat(quiz.getQuizTitle()).isEqualTo("Mock Quiz: Space");
        assertThat(quiz.getQuestions()).hasSize(4);
        assertThat(quiz.getQuestions().get(1).getChoices()).containsExactly("True", "False");
    }

    @Test
    void failsWhenFallbackIsDisabled() {
        server.expect(requestTo(API_URL)).andRespond(withSuccess(
                "{\"candidates\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> source("secret", false).generate(new QuizRequest("Space", null, 2, Difficulty.EASY)))
                .isInstanceOf(QuizGenerationException.class);
    }

    @Test
    void usesMockQuizWithoutApiKey() {
        Quiz quiz = source("", true).generate(new QuizRequest("Cats", null, 2, Difficulty.EASY));

        server.verify();
        assertThat(quiz.getQuizTitle()).isEqualTo("Mock Quiz: Cats");
        assertThat(quiz.getQuestions().get(0).getAnswer()).isEqualTo("First choice");
    }

    @Test
    void promptMentionsSourceMaterialWhenPresent() {
        String prompt = source("secret", false)
                .createPrompt(new QuizRequest("ignored", "Photosynthesis converts light.", 3, Difficulty.HARD));

        assertThat(prompt).contains("exactly 3 questions").contains("Hard").contains("Photosynthesis converts light.");
    }
}
