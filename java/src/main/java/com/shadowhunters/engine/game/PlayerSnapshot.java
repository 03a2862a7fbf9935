package com.shadowhunters.engine.game;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.zones.Zone;

import java.util.List;

/**
 * Public view of a player. Character and faction stay null until revealed.
 */
public record PlayerSnapshot(
    int id,
    String name,
    boolean bot,
    int hp,
    boolean alive,
    boolean revealed,
    Zone zone,
    List<String> equipment,
    String character,
    Faction faction
) {
    public PlayerSnapshot {
        equipment = List.copyOf(equipment);
    }

    public static PlayerSnapshot of(Player player) {
        boolean revealed = player.isRevealed();
        return new PlayerSnapshot(
            player.getId(),
            player.getName(),
            player.isBot(),
            player.getHp(),
            player.isAlive(),
            revealed,
            player.getZone(),
            player.getEquipment().stream().map(Card::getName).toList(),
            revealed ? player.getCharacter().getName() : null,
            revealed ? player.getFaction() : null
        );
    }
}
