package com.shadowhunters.engine.win;

import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.Player;

import java.util.List;
import java.util.Optional;

/**
 * Answer of a win check.
 *
 * @param gameOver       whether the game ends
 * @param winningFaction Hunter or Shadow faction that won, or null
 * @param winners        every winning player, dead or alive, in seat order
 */
public record WinResult(boolean gameOver, Faction winningFaction, List<Player> winners) {

    public WinResult {
        winners = List.copyOf(winners);
    }

    public static WinResult ongoing() {
        return new WinResult(false, null, List.of());
    }

    public Optional<Faction> faction() {
        return Optional.ofNullable(winningFaction);
    }

    public boolean isWinner(Player player) {
        return winners.contains(player);
    }
}
