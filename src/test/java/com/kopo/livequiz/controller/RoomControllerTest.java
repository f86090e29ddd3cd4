package com.kopo.livequiz.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.service.QuizRequest;
import com.kopo.livequiz.service.QuizSource;
import com.kopo.livequiz.support.TestQuizzes;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RoomControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private QuizSource quizSource;

    @BeforeEach
    void setUp() {
        when(quizSource.generate(any())).thenAnswer(invocation -> TestQuizzes.threeQuestions());
    }

    @Test
    void fullGameOverHttp() throws Exception {
        JsonNode created = createRoom("Easy");
        String code = created.path("room_code").asText();
        String hostId = created.path("host_id").asText();
        assertThat(created.path("quiz").path("quiz_title").asText()).isEqualTo("World Trivia");

        String alice = join(code, "Alice");
        String bob = join(code, "Bob");

        mockMvc.perform(get("/rooms/{code}/state", code))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("waiting"))
                .andExpect(jsonPath("$.players.length()").value(2))
                .andExpect(jsonPath("$.question").doesNotExist());

        hostAction(code, "start", hostId)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.current_question_index").value(0))
                .andExpect(jsonPath("$.question.correct_answer").value("Paris"));

        mockMvc.perform(get("/rooms/{code}/state", code.toLowerCase()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.question.question").value("Capital of France?"))
                .andExpect(jsonPath("$.question.answer_window_seconds").value(15))
                .andExpect(jsonPath("$.question.correct_answer").doesNotExist());

        answer(code, alice, "Paris", 0)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.players[0].score").value(1))
                .andExpect(jsonPath("$.players[0].has_answered_current").value(true));
        answer(code, bob, "London", 0).andExpect(status().isOk());

        hostAction(code, "next", hostId)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_question_index").value(1))
                .andExpect(jsonPath("$.players[0].has_answered_current").value(false));

        answer(code, alice, "Paris", 0).andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("InvalidTransition"));

        hostAction(code, "next", hostId).andExpect(status().isOk());
        hostAction(code, "next", hostId)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("finished"))
                .andExpect(jsonPath("$.players[0].score").value(1))
                .andExpect(jsonPath("$.players[1].score").value(0));

        hostAction(code, "next", hostId).andExpect(status().isConflict());
        mockMvc.perform(post("/rooms/{code}/join", code)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"player_name\": \"Late\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void hostOnlyActionsRejectOtherTokens() throws Exception {
        JsonNode created = createRoom("Medium");
        String code = created.path("room_code").asText();
        String alice = join(code, "Alice");

        hostAction(code, "start", alice)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Forbidden"));
        mockMvc.perform(get("/rooms/{code}/state", code).param("host_id", alice))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/rooms/{code}/state", code))
                .andExpect(jsonPath("$.status").value("waiting"));
    }

    @Test
    void startingEmptyRoomIsConflict() throws Exception {
        JsonNode created = createRoom("Hard");

        hostAction(created.path("room_code").asText(), "start", created.path("host_id").asText())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("EmptyRoom"));
    }

    @Test
    void unknownRoomOrPlayerIsNotFound() throws Exception {
        mockMvc.perform(get("/rooms/{code}/state", "NOPE00"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("RoomNotFound"));

        JsonNode created = createRoom("Easy");
        String code = created.path("room_code").asText();
        join(code, "Alice");
        hostAction(code, "start", created.path("host_id").asText()).andExpect(status().isOk());

        answer(code, "ghost", "Paris", null)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("UnknownPlayer"));
    }

    @Test
    void malformedRequestsAreBadRequest() throws Exception {
        mockMvc.perform(post("/rooms/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host_name\": \"Host\", \"difficulty\": \"Impossible\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BadRequest"));

        mockMvc.perform(post("/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host_name\": \"Host\", \"num_questions\": 50}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/rooms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void generateQuizWithoutRoom() throws Exception {
        mockMvc.perform(post("/generate-quiz/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"Geography\", \"num_questions\": 3, \"difficulty\": \"Easy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quiz_title").value("World Trivia"))
                .andExpect(jsonPath("$.questions[0].answer").value("Paris"));
    }

    @Test
    void createRoomFromUploadedPdf() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.pdf", "application/pdf",
                pdfWithText("Mitochondria are the powerhouse of the cell"));

        mockMvc.perform(multipart("/rooms/upload")
                        .file(file)
                        .param("host_name", "Teacher")
                        .param("num_questions", "3")
                        .param("difficulty", "Hard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room_code").isNotEmpty());

        ArgumentCaptor<QuizRequest> request = ArgumentCaptor.forClass(QuizRequest.class);
        verify(quizSource).generate(request.capture());
        assertThat(request.getValue().getSourceText()).contains("Mitochondria");
        assertThat(request.getValue().getDifficulty()).isEqualTo(Difficulty.HARD);
    }

    @Test
    void healthAndHome() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.rooms").isNumber());
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("running")))
                .andExpect(content().string(containsString("Active rooms:")));
    }

    @Test
    void apiDocsDescribeRoomApi() throws Exception {
        mockMvc.perform(get("/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Live Quiz API Documentation"))
                .andExpect(jsonPath("$.servers[0].url").value("http://localhost:3002"))
                .andExpect(jsonPath("$.tags[?(@.name == 'Room')]").exists())
                .andExpect(jsonPath("$.paths['/rooms/{roomCode}/state']").exists());
    }

    private JsonNode createRoom(String difficulty) throws Exception {
        MvcResult result = mockMvc.perform(post("/rooms/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"host_name\": \"Host\", \"prompt\": \"Geography\", \"num_questions\": 3, "
                                + "\"difficulty\": \"" + difficulty + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String join(String code, String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/rooms/{code}/join", code)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"player_name\": \"" + name + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room_code").value(code))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("player_id").asText();
    }

    private ResultActions hostAction(String code, String action, String hostId)
            throws Exception {
        return mockMvc.perform(post("/rooms/{code}/" + action, code)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"host_id\": \"" + hostId + "\"}"));
    }

    private ResultActions answer(String code, String playerId, String choice, Integer questionIndex) throws Exception {
        String index = questionIndex == null ? "" : ", \"question_index\": " + questionIndex;
        return mockMvc.perform(post("/rooms/{code}/answer", code)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"player_id\": \"" + playerId + "\", \"answer\": \"" + choice + "\"" + index + "}"));
    }

    private static byte[] pdfWithText(String text) throws Exception {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(PDType1Font.HELVETICA, 12);
                stream.newLineAtOffset(50, 700);
                stream.showText(text);
                stream.endText();
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
