package com.fakebusters.backend.modules.board.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fakebusters.backend.modules.board.domain.Board;

public interface BoardRepository extends JpaRepository<Board, UUID> {
}
