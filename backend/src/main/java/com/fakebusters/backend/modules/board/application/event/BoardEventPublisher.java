package com.fakebusters.backend.modules.board.application.event;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.fakebusters.backend.modules.board.domain.Board;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Hands board events to the {@link BoardEventBus} once the surrounding transaction has committed.
 * Outside a transaction the event is published immediately. Rolled-back transactions publish nothing.
 */
@Component
public class BoardEventPublisher {

    private final BoardEventBus boardEventBus;
    private final Clock clock;

    public BoardEventPublisher(BoardEventBus boardEventBus, Clock clock) {
        this.boardEventBus = boardEventBus;
        this.clock = clock;
    }

    public void publishAfterCommit(BoardEventType type, Board board) {
        BoardEvent event = BoardEvent.of(type, BoardSnapshot.of(board), OffsetDateTime.now(clock));
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            boardEventBus.publish(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                boardEventBus.publish(event);
            }
        });
    }
}
