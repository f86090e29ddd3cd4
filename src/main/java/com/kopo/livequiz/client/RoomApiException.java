package com.kopo.livequiz.client;

/**
 * 방 API 호출 실패. status 가 0 이면 응답을 받지 못한 네트워크 오류다.
 */
public class RoomApiException extends RuntimeException {

    private final int status;
    private final String error;

    public RoomApiException(int status, String error, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.error = error;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return getMessage();
    }

    /**
     * 네트워크 오류나 5xx. 조회는 다시 시도해도 되지만 advance 는 절대 재시도하지 않는다.
     */
    public boolean isTransient() {
        return status == 0 || status >= 500;
    }

    public boolean isRoomGone() {
        return status == 404 && "RoomNotFound".equals(error);
    }
}
