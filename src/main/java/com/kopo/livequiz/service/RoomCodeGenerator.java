package com.kopo.livequiz.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 사람이 입력하기 쉬운 6자리 대문자/숫자 방 코드.
 * 중복 검사는 {@link RoomRegistry} 가 한다.
 */
@Component
public class RoomCodeGenerator {

    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        StringBuilder result = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            result.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return result.toString();
    }

    public static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase();
    }
}
