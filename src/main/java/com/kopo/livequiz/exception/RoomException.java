package com.kopo.livequiz.exception;

/**
 * 방 엔진에서 발생하는 모든 업무 오류의 상위 타입.
 * 엔진은 어떤 상태도 바꾸기 전에 검증하므로, 이 예외가 던져졌다면 방 상태는 그대로다.
 */
public abstract class RoomException extends RuntimeException {

    private final String roomCode;

    protected RoomException(String roomCode, String message) {
        super(message);
        this.roomCode = roomCode;
    }

    public String getRoomCode() {
        return roomCode;
    }

    /**
     * 클라이언트에 내려가는 오류 이름 (RoomNotFound, Forbidden ...).
     */
    public abstract String getErrorName();
}
