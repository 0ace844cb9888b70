package com.fakebusters.backend.modules.board.application;

import com.fakebusters.backend.modules.board.domain.Board;

/**
 * Partial board update. {@code null} leaves the current value untouched; a blank string clears it and fails validation.
 */
public record BoardPatch(
        String description,
        String fact,
        Integer phase,
        String rules,
        Integer verdictFalsy,
        Integer verdictTruthy
) {

    BoardAttributes mergeWith(Board current) {
        return new BoardAttributes(
                description != null ? description : current.getDescription(),
                fact != null ? fact : current.getFact(),
                phase != null ? phase : current.getPhase(),
                rules != null ? rules : current.getRules(),
                verdictFalsy != null ? verdictFalsy : current.getVerdictFalsy(),
                verdictTruthy != null ? verdictTruthy : current.getVerdictTruthy()
        );
    }
}
