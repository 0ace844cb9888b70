package com.fakebusters.backend.modules.board.application;

import java.util.UUID;

import com.fakebusters.backend.modules.board.domain.BoardRole;

import jakarta.validation.constraints.NotNull;

/**
 * Identifies the pending request by (user, board). When {@code role} is null the requester's preferred role is granted.
 */
public record ApproveJoinRequestCommand(
        @NotNull UUID userId,
        @NotNull UUID boardId,
        BoardRole role
) {
}
