package com.shadowhunters.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadowhunters.engine.character.Faction;

/**
 * Effect descriptor of a card: kind, magnitude and an optional faction
 * restriction.
 */
public class CardEffect {
    @JsonProperty("kind")
    private EffectKind kind = EffectKind.NONE;

    @JsonProperty("value")
    private int value;

    @JsonProperty("faction")
    private Faction faction;

    public CardEffect() {
    }

    public CardEffect(EffectKind kind, int value, Faction faction) {
        this.kind = kind != null ? kind : EffectKind.NONE;
        this.value = value;
        this.faction = faction;
    }

    public EffectKind getKind() {
        return kind;
    }

    public int getValue() {
        return value;
    }

    /**
     * Faction restriction, or null when the effect applies to everyone.
     */
    public Faction getFaction() {
        return faction;
    }

    /**
     * Check whether the effect applies to a holder.
     * A restricted effect only works for a revealed member of that faction.
     */
    public boolean appliesTo(Faction holderFaction, boolean holderRevealed) {
        if (faction == null) {
            return true;
        }
        return faction == holderFaction && holderRevealed;
    }

    /**
     * Check the faction restriction alone, ignoring reveal state.
     * Used for visions, which are answered secretly, and for kill-time effects.
     */
    public boolean matchesFaction(Faction receiverFaction) {
        return faction == null || faction == receiverFaction;
    }

    public void setKind(EffectKind kind) { this.kind = kind; }
    public void setValue(int value) { this.value = value; }
    public void setFaction(Faction faction) { this.faction = faction; }
}
