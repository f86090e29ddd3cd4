package com.kopo.livequiz.exception;

/** 호스트 토큰이 맞지 않을 때. */
public class ForbiddenException extends RoomException {

    public ForbiddenException(String roomCode) {
        super(roomCode, "Invalid host credentials for this room.");
    }

    @Override
    public String getErrorName() {
        return "Forbidden";
    }
}
