package com.shadowhunters.engine.win;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Kill order of one game. Append-only; a new game starts a new tracker.
 */
public class WinTracker {
    private Integer firstKillerId;
    private Integer firstDeathId;
    private final List<DeathRecord> deaths = new ArrayList<>();

    /**
     * Append a death.
     * @return false if this victim was already recorded
     */
    boolean record(int victimId, Integer killerId, int victimHpMax, int turn) {
        if (hasDied(victimId)) {
            return false;
        }
        if (firstDeathId == null) {
            firstDeathId = victimId;
        }
        if (firstKillerId == null && killerId != null) {
            firstKillerId = killerId;
        }
        deaths.add(new DeathRecord(victimId, killerId, victimHpMax, deaths.size() + 1, turn));
        return true;
    }

    public Optional<Integer> getFirstKillerId() {
        return Optional.ofNullable(firstKillerId);
    }

    public Optional<Integer> getFirstDeathId() {
        return Optional.ofNullable(firstDeathId);
    }

    public boolean hasDied(int playerId) {
        return deaths.stream().anyMatch(d -> d.victimId() == playerId);
    }

    /**
     * Get an unmodifiable copy of the death order.
     */
    public List<DeathRecord> getDeaths() {
        return List.copyOf(deaths);
    }

    public int deathCount() {
        return deaths.size();
    }
}
