package com.fakebusters.backend.modules.board.application.event;

public enum BoardEventType {
    BOARD_CREATED("board_created"),
    BOARD_UPDATED("board_updated"),
    BOARD_DELETED("board_deleted");

    private final String eventName;

    BoardEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
