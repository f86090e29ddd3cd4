package com.kopo.livequiz.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kopo.livequiz.dto.CreateRoomRequest;
import com.kopo.livequiz.dto.CreateRoomResponse;
import com.kopo.livequiz.dto.ErrorResponse;
import com.kopo.livequiz.dto.HostActionRequest;
import com.kopo.livequiz.dto.JoinRoomRequest;
import com.kopo.livequiz.dto.JoinRoomResponse;
import com.kopo.livequiz.dto.RoomStateResponse;
import com.kopo.livequiz.dto.SubmitAnswerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * 방 HTTP API 의 얇은 클라이언트. 실패는 모두 {@link RoomApiException} 으로 바뀐다.
 * 이 클래스는 아무 것도 재시도하지 않는다. 재시도 여부는 호출하는 세션이 정한다.
 */
public class RoomApiClient {

    private static final Logger logger = LoggerFactory.getLogger(RoomApiClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RoomApiClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public CreateRoomResponse createRoom(CreateRoomRequest request) {
        return call("create room", () -> restTemplate.postForObject(baseUrl + "/rooms/", request, CreateRoomResponse.class));
    }

    public JoinRoomResponse joinRoom(String roomCode, String playerName) {
        return call("join room", () -> restTemplate.postForObject(
                baseUrl + "/rooms/{code}/join", new JoinRoomRequest(playerName), JoinRoomResponse.class, roomCode));
    }

    public RoomStateResponse fetchRoomState(String roomCode, String hostId) {
        if (hostId == null) {
            return call("fetch room state", () -> restTemplate.getForObject(
                    baseUrl + "/rooms/{code}/state", RoomStateResponse.class, roomCode));
        }
        return call("fetch room state", () -> restTemplate.getForObject(
                baseUrl + "/rooms/{code}/state?host_id={hostId}", RoomStateResponse.class, roomCode, hostId));
    }

    public RoomStateResponse startRoom(String roomCode, String hostId) {
        return call("start room", () -> restTemplate.postForObject(
                baseUrl + "/rooms/{code}/start", new HostActionRequest(hostId), RoomStateResponse.class, roomCode));
    }

    public RoomStateResponse advanceRoom(String roomCode, String hostId) {
        return call("advance room", () -> restTemplate.postForObject(
                baseUrl + "/rooms/{code}/next", new HostActionRequest(hostId), RoomStateResponse.class, roomCode));
    }

    public RoomStateResponse submitAnswer(String roomCode, String playerId, String answer, Integer questionIndex) {
        return call("submit answer", () -> restTemplate.postForObject(
                baseUrl + "/rooms/{code}/answer", new SubmitAnswerRequest(playerId, answer, questionIndex),
                RoomStateResponse.class, roomCode));
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            ErrorResponse error = parseError(e.getResponseBodyAsString());
            logger.debug("{} 실패: {} {}", action, e.getStatusCode().value(), error.getDetail());
            throw new RoomApiException(e.getStatusCode().value(), error.getError(), error.getDetail(), e);
        } catch (ResourceAccessException e) {
            logger.debug("{} 실패 (네트워크): {}", action, e.getMessage());
            throw new RoomApiException(0, "Unreachable", action + " failed: " + e.getMessage(), e);
        }
    }

    private ErrorResponse parseError(String body) {
        if (body == null || body.isBlank()) {
            return new ErrorResponse("HttpError", "empty error response");
        }
        try {
            ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
            return error.getDetail() == null ? new ErrorResponse(error.getError(), body) : error;
        } catch (JsonProcessingException e) {
            return new ErrorResponse("HttpError", body);
        }
    }
}
