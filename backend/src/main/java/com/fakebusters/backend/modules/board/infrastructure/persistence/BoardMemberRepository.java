package com.fakebusters.backend.modules.board.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.fakebusters.backend.modules.auth.domain.UserAccount;
import com.fakebusters.backend.modules.board.domain.BoardMember;
import com.fakebusters.backend.modules.board.domain.BoardRole;

public interface BoardMemberRepository extends JpaRepository<BoardMember, UUID> {

    long countByBoardId(UUID boardId);

    boolean existsByBoardIdAndUserId(UUID boardId, UUID userId);

    boolean existsByBoardIdAndRole(UUID boardId, BoardRole role);

    Optional<BoardMember> findByBoardIdAndUserId(UUID boardId, UUID userId);

    List<BoardMember> findByBoardId(UUID boardId);

    @Query("""
            select bm.user
              from BoardMember bm
             where bm.board.id = :boardId
               and bm.role = :role
            """)
    Optional<UserAccount> findUserByBoardIdAndRole(
            @Param("boardId") UUID boardId,
            @Param("role") BoardRole role
    );

    @Modifying(flushAutomatically = true)
    @Query("delete from BoardMember bm where bm.board.id = :boardId")
    int deleteAllByBoardId(@Param("boardId") UUID boardId);
}
