package com.fakebusters.backend.modules.board.domain;

import java.util.UUID;

import com.fakebusters.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A case under discussion. Members and join requests reference the board; the board does not own them.
 */
@Entity
@Table(name = "board")
public class Board extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "fact", nullable = false)
    private String fact;

    @Column(name = "phase", nullable = false)
    private Integer phase;

    @Column(name = "rules", nullable = false)
    private String rules;

    @Column(name = "verdict_falsy", nullable = false)
    private Integer verdictFalsy;

    @Column(name = "verdict_truthy", nullable = false)
    private Integer verdictTruthy;

    public UUID getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getFact() {
        return fact;
    }

    public void setFact(String fact) {
        this.fact = fact;
    }

    public Integer getPhase() {
        return phase;
    }

    public void setPhase(Integer phase) {
        this.phase = phase;
    }

    public String getRules() {
        return rules;
    }

    public void setRules(String rules) {
        this.rules = rules;
    }

    public Integer getVerdictFalsy() {
        return verdictFalsy;
    }

    public void setVerdictFalsy(Integer verdictFalsy) {
        this.verdictFalsy = verdictFalsy;
    }

    public Integer getVerdictTruthy() {
        return verdictTruthy;
    }

    public void setVerdictTruthy(Integer verdictTruthy) {
        this.verdictTruthy = verdictTruthy;
    }
}
