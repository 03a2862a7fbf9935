package com.shadowhunters.engine.win;

import com.shadowhunters.engine.game.Player;

/**
 * The event that prompted a win check.
 *
 * @param event  kind of provoking event
 * @param killer killer for a kill check, otherwise null
 * @param victim victim for a kill check, otherwise null
 */
public record WinContext(Event event, Player killer, Player victim) {

    public enum Event {
        KILL,
        GAME_ENDING,
        NONE
    }

    public static WinContext kill(Player killer, Player victim) {
        return new WinContext(Event.KILL, killer, victim);
    }

    public static WinContext gameEnding() {
        return new WinContext(Event.GAME_ENDING, null, null);
    }

    public static WinContext none() {
        return new WinContext(Event.NONE, null, null);
    }

    public boolean isGameEnding() {
        return event == Event.GAME_ENDING;
    }
}
