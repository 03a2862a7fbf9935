package com.shadowhunters.engine.game;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.EffectKind;
import com.shadowhunters.engine.character.CharacterData;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.zones.Zone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A seated player and the character dealt to them.
 * Hit points stay within [0, hpMax]; a dead player is always revealed.
 */
public class Player {
    private final int id;
    private final String name;
    private final boolean bot;
    private final CharacterData character;

    private int hp;
    private boolean alive;
    private boolean revealed;
    private Zone zone;

    private final List<Card> hand;
    private final List<Card> equipment;

    private boolean abilityUsed;
    private boolean abilityDisabled;
    private int extraTurns;
    private final Set<PlayerFlag> flags;

    public Player(int id, String name, boolean bot, CharacterData character) {
        this.id = id;
        this.name = name;
        this.bot = bot;
        this.character = Objects.requireNonNull(character, "character");
        this.hp = character.getHp();
        this.alive = true;
        this.revealed = false;
        this.hand = new ArrayList<>();
        this.equipment = new ArrayList<>();
        this.flags = EnumSet.noneOf(PlayerFlag.class);
    }

    // ---- Identity ----
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isBot() {
        return bot;
    }

    public CharacterData getCharacter() {
        return character;
    }

    public Optional<CharacterId> getCharacterId() {
        return character.characterId();
    }

    public boolean is(CharacterId characterId) {
        return getCharacterId().filter(c -> c == characterId).isPresent();
    }

    public Faction getFaction() {
        return character.getFaction();
    }

    // ---- Vital state ----
    public int getHp() {
        return hp;
    }

    public int getHpMax() {
        return character.getHp();
    }

    public boolean isAlive() {
        return alive;
    }

    /**
     * Alive and above the death threshold.
     */
    public boolean isStanding() {
        return alive && hp > 0;
    }

    /**
     * Lose hit points, never below zero.
     * @return hit points actually lost
     */
    public int loseHp(int amount) {
        int lost = Math.min(Math.max(amount, 0), hp);
        hp -= lost;
        return lost;
    }

    /**
     * Heal, never above hpMax.
     * @return hit points actually restored
     */
    public int heal(int amount) {
        if (!alive || amount <= 0) {
            return 0;
        }
        int healed = Math.min(amount, getHpMax() - hp);
        hp += healed;
        return healed;
    }

    /**
     * Set hit points directly, clamped to [0, hpMax].
     */
    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(hp, getHpMax()));
    }

    /**
     * Mark dead; death always reveals the character and drops its protections.
     * A direction swap survives death.
     */
    public void markDead() {
        alive = false;
        revealed = true;
        hp = 0;
        flags.remove(PlayerFlag.SHIELDED);
        flags.remove(PlayerFlag.DAMAGE_IMMUNE);
    }

    // ---- Secret state ----
    public boolean isRevealed() {
        return revealed;
    }

    /**
     * Turn the character card face up.
     * @return true if the player was not revealed before
     */
    public boolean reveal() {
        if (revealed) {
            return false;
        }
        revealed = true;
        return true;
    }

    // ---- Board ----
    public Zone getZone() {
        return zone;
    }

    public void setZone(Zone zone) {
        this.zone = zone;
    }

    // ---- Cards ----
    public List<Card> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public List<Card> getEquipment() {
        return List.copyOf(equipment);
    }

    public int equipmentCount() {
        return equipment.size();
    }

    public void equip(Card card) {
        equipment.add(card);
    }

    public boolean unequip(Card card) {
        return equipment.remove(card);
    }

    /**
     * Remove and return all equipment.
     */
    public List<Card> removeAllEquipment() {
        List<Card> removed = new ArrayList<>(equipment);
        equipment.clear();
        return removed;
    }

    /**
     * Equipment of one effect kind whose faction restriction this player meets.
     */
    public List<Card> activeEquipment(EffectKind kind) {
        return equipment.stream()
                .filter(c -> c.hasEffect(kind))
                .filter(c -> c.getEffect().appliesTo(getFaction(), revealed))
                .toList();
    }

    /**
     * Sum of effect values over active equipment of one kind.
     */
    public int equipmentBonus(EffectKind kind) {
        return activeEquipment(kind).stream()
                .mapToInt(c -> c.getEffect().getValue())
                .sum();
    }

    // ---- Ability state ----
    public boolean isAbilityUsed() {
        return abilityUsed;
    }

    public void markAbilityUsed() {
        this.abilityUsed = true;
    }

    public boolean isAbilityDisabled() {
        return abilityDisabled;
    }

    public void disableAbility() {
        this.abilityDisabled = true;
    }

    public int getExtraTurns() {
        return extraTurns;
    }

    public void addExtraTurns(int turns) {
        this.extraTurns += Math.max(0, turns);
    }

    boolean consumeExtraTurn() {
        if (extraTurns <= 0) {
            return false;
        }
        extraTurns--;
        return true;
    }

    // ---- Flags ----
    public boolean hasFlag(PlayerFlag flag) {
        return flags.contains(flag);
    }

    public void setFlag(PlayerFlag flag) {
        flags.add(flag);
    }

    /**
     * @return true if the flag was set
     */
    public boolean clearFlag(PlayerFlag flag) {
        return flags.remove(flag);
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
