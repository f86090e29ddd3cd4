package com.kopo.livequiz.exception;

public class UnknownPlayerException extends RoomException {

    private final String playerId;

    public UnknownPlayerException(String roomCode, String playerId) {
        super(roomCode, "Player is not part of this room.");
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }

    @Override
    public String getErrorName() {
        return "UnknownPlayer";
    }
}
