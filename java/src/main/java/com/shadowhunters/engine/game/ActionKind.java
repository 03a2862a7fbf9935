package com.shadowhunters.engine.game;

import java.util.Optional;

/**
 * Actions a player can request on their turn.
 */
public enum ActionKind {
    ROLL_MOVEMENT("roll_dice"),
    MOVE("move"),
    DRAW_CARD("draw_card"),
    ATTACK("attack"),
    END_TURN("end_turn");

    private final String id;

    ActionKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<ActionKind> fromId(String id) {
        for (ActionKind kind : values()) {
            if (kind.id.equals(id)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
