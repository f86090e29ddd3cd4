package com.kopo.livequiz.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Value("${server.port:3002}")
    private int serverPort;

    @Bean
    public OpenAPI openAPI() {
        Info info = new Info()
                .title("Live Quiz API Documentation")
                .version("1.0.0")
                .description("실시간 멀티플레이 퀴즈 방 API 명세서입니다.\n\n"
                        + "- 호스트는 방을 만들고 host_id 로 시작/다음 문제를 요청합니다.\n"
                        + "- 플레이어는 방 코드로 참가해 player_id 로 답을 제출합니다.\n"
                        + "- 서버는 이벤트를 보내지 않습니다. 모든 클라이언트는 GET /rooms/{code}/state 를 약 2초 간격으로 폴링합니다.");
        Server local = new Server()
                .url("http://localhost:" + serverPort)
                .description("로컬 개발 서버");
        return new OpenAPI()
                .components(new Components())
                .info(info)
                .servers(List.of(local))
                .tags(List.of(
                        new Tag().name("Room").description("방 생성/참가/진행, 상태 폴링"),
                        new Tag().name("Quiz").description("방 없이 퀴즈만 생성"),
                        new Tag().name("Health Check").description("서버 상태 확인")));
    }
}
