package com.fakebusters.backend.modules.board.application;

import com.fakebusters.backend.modules.board.domain.Board;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Complete set of board attributes. Every field is required on create and must still be present after an update.
 */
public record BoardAttributes(
        @NotBlank String description,
        @NotBlank String fact,
        @NotNull Integer phase,
        @NotBlank String rules,
        @NotNull Integer verdictFalsy,
        @NotNull Integer verdictTruthy
) {

    void applyTo(Board board) {
        board.setDescription(description);
        board.setFact(fact);
        board.setPhase(phase);
        board.setRules(rules);
        board.setVerdictFalsy(verdictFalsy);
        board.setVerdictTruthy(verdictTruthy);
    }
}
