package com.kopo.livequiz.exception;

/** 현재 방 상태에서 허용되지 않는 작업. */
public class InvalidTransitionException extends RoomException {

    public InvalidTransitionException(String roomCode, String message) {
        super(roomCode, message);
    }

    @Override
    public String getErrorName() {
        return "InvalidTransition";
    }
}
