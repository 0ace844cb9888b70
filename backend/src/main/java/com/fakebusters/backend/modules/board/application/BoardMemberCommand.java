package com.fakebusters.backend.modules.board.application;

import java.util.UUID;

import com.fakebusters.backend.modules.board.domain.BoardRole;

import jakarta.validation.constraints.NotNull;

public record BoardMemberCommand(
        @NotNull BoardRole role,
        UUID userId,
        UUID boardId
) {
}
