package com.fakebusters.backend.modules.board.application.event;

/**
 * In-process publish/subscribe channel for board notifications.
 *
 * <p>There is a single topic. Delivery is synchronous and best-effort: only listeners registered at
 * publish time receive an event, nothing is queued or replayed.
 */
public interface BoardEventBus {

    String TOPIC = "boards";

    Subscription subscribe(BoardEventListener listener);

    void publish(BoardEvent event);

    interface Subscription extends AutoCloseable {

        void cancel();

        @Override
        default void close() {
            cancel();
        }
    }
}
