package com.kopo.livequiz.controller;

import com.kopo.livequiz.service.RoomRegistry;
import io.swagger.v3.oas.annotations.Hidden;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class HomeController {

    private static final Logger logger = LoggerFactory.getLogger(HomeController.class);

    @Autowired
    private RoomRegistry roomRegistry;

    @Value("${springdoc.swagger-ui.path:/swagger-ui.html}")
    private String docsPath;

    @GetMapping("/")
    public String home() {
        logger.info("=== 홈 페이지 접속 ===");
        return "Live Quiz Backend Server is running! Active rooms: " + roomRegistry.roomCount()
                + ". API docs: " + docsPath;
    }
}
