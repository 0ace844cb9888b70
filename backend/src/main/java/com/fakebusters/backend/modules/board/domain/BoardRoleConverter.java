package com.fakebusters.backend.modules.board.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class BoardRoleConverter implements AttributeConverter<BoardRole, Integer> {

    @Override
    public Integer convertToDatabaseColumn(BoardRole role) {
        return role != null ? role.getCode() : null;
    }

    @Override
    public BoardRole convertToEntityAttribute(Integer code) {
        return code != null ? BoardRole.fromCode(code) : null;
    }
}
