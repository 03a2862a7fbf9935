package com.shadowhunters.engine.event;

@FunctionalInterface
public interface GameEventListener {

    void onEvent(GameEvent event);
}
