package com.fakebusters.backend.modules.board.domain;

import java.util.Arrays;

/**
 * Role of a user on a board. Persisted as its integer code; {@code 0} is the judge who owns the board.
 */
public enum BoardRole {
    JUDGE(0),
    JUROR(1),
    AUDIENCE(2);

    private final int code;

    BoardRole(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isJudge() {
        return this == JUDGE;
    }

    public static BoardRole fromCode(int code) {
        return Arrays.stream(values())
                .filter(role -> role.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown board role code: " + code));
    }
}
