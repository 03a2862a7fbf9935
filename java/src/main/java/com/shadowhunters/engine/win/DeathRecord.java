package com.shadowhunters.engine.win;

/**
 * One entry of the death order.
 *
 * @param victimId       id of the player who died
 * @param killerId       id of the killer, or null
 * @param victimHpMax    maximum hit points of the victim's character
 * @param deadCountAfter number of dead players including this one
 * @param turn           turn number of the death
 */
public record DeathRecord(int victimId, Integer killerId, int victimHpMax, int deadCountAfter, int turn) {

    public boolean killedBy(int playerId) {
        return killerId != null && killerId == playerId;
    }
}
