package com.fakebusters.backend.modules.board.domain;

import java.util.UUID;

import com.fakebusters.backend.global.jpa.AbstractTimestampedEntity;
import com.fakebusters.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * A pending request to join a board. The row is removed when the request is approved or withdrawn.
 */
@Entity
@Table(
        name = "join_request",
        uniqueConstraints = @UniqueConstraint(name = "uq_join_request_board_user", columnNames = {"board_id", "user_id"})
)
public class JoinRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "motivation", nullable = false)
    private String motivation;

    @Convert(converter = BoardRoleConverter.class)
    @Column(name = "preferred_role", nullable = false)
    private BoardRole preferredRole;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private UserAccount user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "board_id")
    private Board board;

    public UUID getId() {
        return id;
    }

    public String getMotivation() {
        return motivation;
    }

    public void setMotivation(String motivation) {
        this.motivation = motivation;
    }

    public BoardRole getPreferredRole() {
        return preferredRole;
    }

    public void setPreferredRole(BoardRole preferredRole) {
        this.preferredRole = preferredRole;
    }

    public UserAccount getUser() {
        return user;
    }

    public void setUser(UserAccount user) {
        this.user = user;
    }

    public Board getBoard() {
        return board;
    }

    public void setBoard(Board board) {
        this.board = board;
    }
}
