package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.character.TriggerKey;
import com.shadowhunters.engine.character.UsagePolicy;
import com.shadowhunters.engine.game.Player;

/**
 * A registered passive ability.
 */
public record AbilityRegistration(Player player, TriggerKey trigger, UsagePolicy usage, boolean requiresReveal) {
}
