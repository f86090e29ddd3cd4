package com.kopo.livequiz.exception;

public class RoomNotFoundException extends RoomException {

    public RoomNotFoundException(String roomCode) {
        super(roomCode, "Room '" + roomCode + "' does not exist.");
    }

    @Override
    public String getErrorName() {
        return "RoomNotFound";
    }
}
