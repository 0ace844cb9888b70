package com.fakebusters.backend.modules.board.application;

import com.fakebusters.backend.modules.board.domain.BoardRole;
import com.fakebusters.backend.modules.board.domain.JoinRequest;

public record JoinRequestPatch(
        String motivation,
        BoardRole preferredRole
) {

    JoinRequestCommand mergeWith(JoinRequest current) {
        return new JoinRequestCommand(
                motivation != null ? motivation : current.getMotivation(),
                preferredRole != null ? preferredRole : current.getPreferredRole(),
                null,
                null
        );
    }
}
