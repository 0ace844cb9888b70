package com.fakebusters.backend.modules.board.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fakebusters.backend.modules.board.domain.JoinRequest;

public interface JoinRequestRepository extends JpaRepository<JoinRequest, UUID> {

    boolean existsByBoardIdAndUserId(UUID boardId, UUID userId);

    Optional<JoinRequest> findByBoardIdAndUserId(UUID boardId, UUID userId);

    @EntityGraph(attributePaths = {"user", "board"})
    List<JoinRequest> findByBoardId(UUID boardId);

    @EntityGraph(attributePaths = {"user", "board"})
    List<JoinRequest> findByBoardIdOrderByCreatedAtDesc(UUID boardId);

    /**
     * Bulk delete by id. Returns the number of removed rows so callers can tell whether another
     * transaction consumed the request first.
     */
    @Modifying(flushAutomatically = true)
    @Query("delete from JoinRequest jr where jr.id = :id")
    int deletePendingById(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("delete from JoinRequest jr where jr.board.id = :boardId")
    int deleteAllByBoardId(@Param("boardId") UUID boardId);
}
