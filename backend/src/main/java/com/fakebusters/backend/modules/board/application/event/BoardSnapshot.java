package com.fakebusters.backend.modules.board.application.event;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fakebusters.backend.modules.board.domain.Board;

/**
 * Immutable copy of a board taken when an event is raised, so subscribers never touch a managed entity
 * after the publishing transaction has closed.
 */
public record BoardSnapshot(
        UUID id,
        String description,
        String fact,
        Integer phase,
        String rules,
        Integer verdictFalsy,
        Integer verdictTruthy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static BoardSnapshot of(Board board) {
        return new BoardSnapshot(
                board.getId(),
                board.getDescription(),
                board.getFact(),
                board.getPhase(),
                board.getRules(),
                board.getVerdictFalsy(),
                board.getVerdictTruthy(),
                board.getCreatedAt(),
                board.getUpdatedAt()
        );
    }
}
