package com.fakebusters.backend.modules.board.application.event;

@FunctionalInterface
public interface BoardEventListener {

    void onBoardEvent(BoardEvent event);
}
