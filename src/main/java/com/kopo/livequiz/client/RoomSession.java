package com.kopo.livequiz.client;

import com.kopo.livequiz.dto.RoomStateResponse;

import java.time.Clock;
import java.time.Duration;

/**
 * 호스트/플레이어 세션 공통부. 한 세션은 한 방에 대해 폴러 하나를 가진다.
 */
public abstract class RoomSession implements AutoCloseable {

    protected final RoomApiClient api;
    protected final Clock clock;
    protected String roomCode;
    private RoomPoller poller;

    protected RoomSession(RoomApiClient api, Clock clock) {
        this.api = api;
        this.clock = clock;
    }

    /**
     * 이 세션 권한으로 본 현재 스냅샷.
     */
    protected abstract RoomStateResponse fetchState();

    protected RoomSyncListener decorate(RoomSyncListener listener) {
        return listener;
    }

    public RoomPoller startPolling(RoomSyncListener listener) {
        return startPolling(listener, RoomPoller.DEFAULT_POLL_INTERVAL);
    }

    /**
     * 폴러 하나를 띄운다. 이전 폴러는 세션 락 밖에서 멈춘다.
     */
    public RoomPoller startPolling(RoomSyncListener listener, Duration interval) {
        requireRoom();
        RoomPoller started = new RoomPoller(roomCode, this::fetchState, decorate(listener), clock, interval);
        RoomPoller previous;
        synchronized (this) {
            previous = poller;
            poller = started;
        }
        if (previous != null) {
            previous.stop();
        }
        started.start();
        return started;
    }

    public RoomStateResponse getLastState() {
        RoomPoller current = currentPoller();
        return current == null ? null : current.getLastState();
    }

    protected synchronized RoomPoller currentPoller() {
        return poller;
    }

    public String getRoomCode() {
        return roomCode;
    }

    protected void requireRoom() {
        if (roomCode == null) {
            throw new IllegalStateException("Session is not attached to a room yet");
        }
    }

    @Override
    public void close() {
        RoomPoller current = currentPoller();
        if (current != null) {
            current.stop();
        }
    }
}
