package com.fakebusters.backend.modules.board.application.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InProcessBoardEventBus implements BoardEventBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessBoardEventBus.class);

    private final List<BoardEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(BoardEventListener listener) {
        Objects.requireNonNull(listener, "listener is required");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void publish(BoardEvent event) {
        Objects.requireNonNull(event, "event is required");
        log.debug("Dispatching {} for board {} to {} listener(s)",
                event.type().getEventName(), event.board().id(), listeners.size());
        for (BoardEventListener listener : listeners) {
            try {
                listener.onBoardEvent(event);
            } catch (RuntimeException ex) {
                // a failing subscriber must not starve the others
                log.warn("Board event listener {} failed on {} for board {}",
                        listener, event.type().getEventName(), event.board().id(), ex);
            }
        }
    }

    int listenerCount() {
        return listeners.size();
    }
}
