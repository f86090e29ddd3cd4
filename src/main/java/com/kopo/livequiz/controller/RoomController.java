package com.kopo.livequiz.controller;

import com.kopo.livequiz.dto.CreateRoomRequest;
import com.kopo.livequiz.dto.CreateRoomResponse;
import com.kopo.livequiz.dto.ErrorResponse;
import com.kopo.livequiz.dto.HostActionRequest;
import com.kopo.livequiz.dto.JoinRoomRequest;
import com.kopo.livequiz.dto.JoinRoomResponse;
import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.dto.SubmitAnswerRequest;
import com.kopo.livequiz.entity.Difficulty;
import com.kopo.livequiz.entity.Player;
import com.kopo.livequiz.entity.Quiz;
import com.kopo.livequiz.entity.Room;
import com.kopo.livequiz.service.QuizGenerationService;
import com.kopo.livequiz.service.RoomRegistry;
import com.kopo.livequiz.service.RoomSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/rooms")
@CrossOrigin(origins = "*")
@Tag(name = "Room", description = "멀티플레이 방 생성/참가/진행 API (클라이언트는 state 를 주기적으로 폴링)")
public class RoomController {

    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    @Autowired
    private RoomRegistry roomRegistry;

    @Autowired
    private RoomSessionService roomSessionService;

    @Autowired
    private QuizGenerationService quizGenerationService;

    @PostMapping({"", "/"})
    @Operation(summary = "방 생성", description = "주제로 퀴즈를 생성하고 대기 상태의 방을 만듭니다. 응답의 quiz 에는 정답이 포함됩니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "방 생성 성공", content = @Content(schema = @Schema(implementation = CreateRoomResponse.class))),
        @ApiResponse(responseCode = "400", description = "잘못된 요청", content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "퀴즈 생성 실패", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<CreateRoomResponse> createRoom(@RequestBody CreateRoomRequest request) {
        logger.info("=== 방 생성 API 호출 ===");
        logger.info("요청 데이터: {}", request);

        Difficulty difficulty = Difficulty.from(request.getDifficulty());
        Quiz quiz = quizGenerationService.generateQuiz(request.getPrompt(), request.getNumQuestions(), difficulty);
        Room room = roomRegistry.createRoom(quiz, difficulty, request.getHostName());

        logger.info("방 생성 성공: {} (호스트: {})", room.getCode(), room.getHostName());
        return ResponseEntity.ok(new CreateRoomResponse(room.getCode(), room.getHostId(), room.getQuiz()));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "PDF 로 방 생성", description = "업로드한 PDF 내용으로 퀴즈를 생성하고 방을 만듭니다.")
    public ResponseEntity<CreateRoomResponse> createRoomFromFile(
            @RequestParam("host_name") String hostName,
            @RequestParam(value = "num_questions", required = false) Integer numQuestions,
            @RequestParam(value = "difficulty", required = false) String difficultyValue,
            @RequestParam(value = "prompt", required = false) String prompt,
            @RequestPart("file") MultipartFile file) {
        logger.info("=== PDF 방 생성 API 호출 ===");
        logger.info("PDF 파일명: {} ({} bytes)", file.getOriginalFilename(), file.getSize());

        if (file.isEmpty()) {
            throw new IllegalArgumentException("file must not be empty");
        }
        Difficulty difficulty = Difficulty.from(difficultyValue);
        Quiz quiz = quizGenerationService.generateQuiz(prompt, numQuestions, difficulty, file);
        Room room = roomRegistry.createRoom(quiz, difficulty, hostName);

        logger.info("방 생성 성공: {} (호스트: {})", room.getCode(), room.getHostName());
        return ResponseEntity.ok(new CreateRoomResponse(room.getCode(), room.getHostId(), room.getQuiz()));
    }

    @PostMapping("/{roomCode}/join")
    @Operation(summary = "방 참가", description = "방 코드로 참가하고 플레이어 토큰을 받습니다. 진행 중에도 참가할 수 있지만 다음 문제부터 답할 수 있습니다.")
    @ApiResponse(responseCode = "200", description = "방 참가 성공", content = @Content(schema = @Schema(implementation = JoinRoomResponse.class)))
    @ApiResponse(responseCode = "404", description = "방을 찾을 수 없음", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public ResponseEntity<JoinRoomResponse> joinRoom(
            @Parameter(description = "방 코드", required = true, example = "AB12CD") @PathVariable String roomCode,
            @RequestBody JoinRoomRequest request) {
        logger.info("=== 방 참가 API 호출 ===");
        logger.info("방 코드: {}, 참가자: {}", roomCode, request.getPlayerName());

        Player player = roomRegistry.joinRoom(roomCode, request.getPlayerName());
        Room room = roomRegistry.requireRoom(roomCode);
        Room.RoomStatus status = room.withReadLock(room::getStatus);

        return ResponseEntity.ok(new JoinRoomResponse(room.getCode(), player.getId(), room.getQuiz().getQuizTitle(), status));
    }

    @GetMapping("/{roomCode}/state")
    @Operation(summary = "방 상태 조회 (폴링)", description = "현재 방 스냅샷을 조회합니다. host_id 를 주면 정답이 포함된 호스트 뷰를 돌려줍니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "조회 성공", content = @Content(schema = @Schema(implementation = RoomStateResponse.class))),
        @ApiResponse(responseCode = "403", description = "호스트 토큰 불일치"),
        @ApiResponse(responseCode = "404", description = "방을 찾을 수 없음")
    })
    public ResponseEntity<RoomStateResponse> getRoomState(
            @Parameter(description = "방 코드", required = true) @PathVariable String roomCode,
            @Parameter(description = "호스트 토큰 (호스트 뷰가 필요할 때만)") @RequestParam(value = "host_id", required = false) String hostId) {
        // 2초마다 호출되므로 debug 로만 남긴다
        logger.debug("방 상태 조회: {}", roomCode);
        return ResponseEntity.ok(roomRegistry.getRoomState(roomCode, hostId));
    }

    @PostMapping("/{roomCode}/start")
    @Operation(summary = "게임 시작", description = "호스트가 첫 문제를 엽니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "게임 시작 성공", content = @Content(schema = @Schema(implementation = RoomStateResponse.class))),
        @ApiResponse(responseCode = "403", description = "호스트가 아님"),
        @ApiResponse(responseCode = "409", description = "이미 시작했거나 참가자가 없음")
    })
    public ResponseEntity<RoomStateResponse> startRoom(@PathVariable String roomCode, @RequestBody HostActionRequest request) {
        logger.info("=== 게임 시작 API 호출 === 방 코드: {}", roomCode);
        return ResponseEntity.ok(roomSessionService.start(roomCode, request.getHostId()));
    }

    @PostMapping("/{roomCode}/next")
    @Operation(summary = "다음 문제로 이동", description = "호스트가 현재 문제를 마감하고 다음 문제로 넘깁니다. 마지막 문제였다면 게임이 종료됩니다. 멱등이 아니므로 재시도하지 마세요.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "이동 성공 또는 퀴즈 종료", content = @Content(schema = @Schema(implementation = RoomStateResponse.class))),
        @ApiResponse(responseCode = "403", description = "호스트가 아님"),
        @ApiResponse(responseCode = "409", description = "진행 중이 아님")
    })
    public ResponseEntity<RoomStateResponse> advanceRoom(@PathVariable String roomCode, @RequestBody HostActionRequest request) {
        logger.info("=== 다음 문제 API 호출 === 방 코드: {}", roomCode);
        return ResponseEntity.ok(roomSessionService.advance(roomCode, request.getHostId()));
    }

    @PostMapping("/{roomCode}/answer")
    @Operation(summary = "답변 제출", description = "현재 문제에 답합니다. 같은 문제에 다시 제출하면 아무 것도 바뀌지 않고 성공합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "제출 성공 (중복 제출 포함)", content = @Content(schema = @Schema(implementation = RoomStateResponse.class))),
        @ApiResponse(responseCode = "404", description = "방 또는 플레이어를 찾을 수 없음"),
        @ApiResponse(responseCode = "409", description = "진행 중이 아니거나 이미 지나간 문제")
    })
    public ResponseEntity<RoomStateResponse> submitAnswer(@PathVariable String roomCode, @RequestBody SubmitAnswerRequest request) {
        logger.info("=== 답안 제출 API 호출 === 방 코드: {}, 문제 인덱스: {}", roomCode, request.getQuestionIndex());
        return ResponseEntity.ok(roomSessionService.submitAnswer(
                roomCode, request.getPlayerId(), request.getAnswer(), request.getQuestionIndex()));
    }
}
