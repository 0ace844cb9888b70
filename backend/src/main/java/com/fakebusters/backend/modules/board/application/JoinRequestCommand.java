package com.fakebusters.backend.modules.board.application;

import java.util.UUID;

import com.fakebusters.backend.modules.board.domain.BoardRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record JoinRequestCommand(
        @NotBlank String motivation,
        @NotNull BoardRole preferredRole,
        UUID userId,
        UUID boardId
) {
}
