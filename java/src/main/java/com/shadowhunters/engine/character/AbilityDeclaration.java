package com.shadowhunters.engine.character;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The ability printed on a character card.
 */
public class AbilityDeclaration {
    @JsonProperty("name")
    private String name;

    @JsonProperty("kind")
    private AbilityKind kind = AbilityKind.STATIC;

    @JsonProperty("trigger")
    private String trigger = TriggerKey.MANUAL.getKey();

    @JsonProperty("usage")
    private UsagePolicy usage = UsagePolicy.UNLIMITED;

    @JsonProperty("requires_reveal")
    private boolean requiresReveal;

    @JsonProperty("description")
    private String description;

    public AbilityDeclaration() {
    }

    public AbilityDeclaration(String name, AbilityKind kind, String trigger,
                              UsagePolicy usage, boolean requiresReveal) {
        this.name = name;
        this.kind = kind;
        this.trigger = trigger;
        this.usage = usage;
        this.requiresReveal = requiresReveal;
    }

    public String getName() {
        return name;
    }

    public AbilityKind getKind() {
        return kind;
    }

    /**
     * Raw trigger key as written in the data.
     */
    public String getTrigger() {
        return trigger;
    }

    public UsagePolicy getUsage() {
        return usage;
    }

    public boolean isRequiresReveal() {
        return requiresReveal;
    }

    public String getDescription() {
        return description;
    }

    // Setters for Jackson
    public void setName(String name) { this.name = name; }
    public void setKind(AbilityKind kind) { this.kind = kind; }
    public void setTrigger(String trigger) { this.trigger = trigger; }
    public void setUsage(UsagePolicy usage) { this.usage = usage; }
    public void setRequiresReveal(boolean requiresReveal) { this.requiresReveal = requiresReveal; }
    public void setDescription(String description) { this.description = description; }
}
