package com.fakebusters.backend.modules.board.application.event;

import java.time.OffsetDateTime;
import java.util.Objects;

public record BoardEvent(
        String topic,
        BoardEventType type,
        BoardSnapshot board,
        OffsetDateTime occurredAt
) {

    public BoardEvent {
        Objects.requireNonNull(topic, "topic is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(board, "board is required");
        Objects.requireNonNull(occurredAt, "occurredAt is required");
    }

    public static BoardEvent of(BoardEventType type, BoardSnapshot board, OffsetDateTime occurredAt) {
        return new BoardEvent(BoardEventBus.TOPIC, type, board, occurredAt);
    }
}
