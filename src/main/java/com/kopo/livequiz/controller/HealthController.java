package com.kopo.livequiz.controller;

import com.kopo.livequiz.service.RoomRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Health Check", description = "서버 상태 확인 API")
public class HealthController {

    @Autowired
    private RoomRegistry roomRegistry;

    @GetMapping("/health")
    @Operation(summary = "서버 헬스 체크", description = "서버 동작 여부와 메모리에 있는 방 개수를 확인합니다.")
    public Map<String, Object> healthCheck() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("rooms", roomRegistry.roomCount());
        return body;
    }
}
