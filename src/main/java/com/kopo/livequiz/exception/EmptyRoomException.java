package com.kopo.livequiz.exception;

public class EmptyRoomException extends RoomException {

    public EmptyRoomException(String roomCode) {
        super(roomCode, "At least one player must join before starting the game.");
    }

    @Override
    public String getErrorName() {
        return "EmptyRoom";
    }
}
