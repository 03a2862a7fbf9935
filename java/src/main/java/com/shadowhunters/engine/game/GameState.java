package com.shadowhunters.engine.game;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.rng.GameRng;
import com.shadowhunters.engine.win.WinResult;
import com.shadowhunters.engine.win.WinTracker;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete state of one game session.
 * Created at setup and discarded when the game is over; a new game gets a
 * new instance.
 */
public class GameState {
    // Roster, in seat order
    private final List<Player> players;
    private final Map<DeckColor, Deck> decks;
    private final GameRng rng;
    private final WinTracker winTracker;

    // Turn info
    private int turn;
    private Phase phase;
    private int currentIndex;
    private boolean started;

    // Per-turn flags
    private boolean rolledThisTurn;
    private int movementRoll;
    private boolean movedThisTurn;
    private boolean drawnThisTurn;
    private boolean attackedThisTurn;

    private WinResult result;

    public GameState(List<Player> players, Map<DeckColor, Deck> decks, GameRng rng) {
        if (players.isEmpty()) {
            throw new IllegalArgumentException("A game needs at least one player");
        }
        this.players = List.copyOf(players);
        this.decks = new EnumMap<>(DeckColor.class);
        this.decks.putAll(decks);
        this.rng = rng;
        this.winTracker = new WinTracker();
        this.turn = 1;
        this.phase = Phase.MOVEMENT;
        this.currentIndex = 0;
        this.result = WinResult.ongoing();
    }

    // ---- Roster ----
    public List<Player> getPlayers() {
        return players;
    }

    public Optional<Player> getPlayer(int id) {
        return players.stream().filter(p -> p.getId() == id).findFirst();
    }

    public List<Player> livingPlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    public int deadCount() {
        return (int) players.stream().filter(p -> !p.isAlive()).count();
    }

    public int seatOf(Player player) {
        return players.indexOf(player);
    }

    /**
     * The player seated after this one.
     */
    public Player rightNeighbor(Player player) {
        int seat = seatOf(player);
        return players.get((seat + 1) % players.size());
    }

    /**
     * The player seated before this one.
     */
    public Player leftNeighbor(Player player) {
        int seat = seatOf(player);
        return players.get((seat - 1 + players.size()) % players.size());
    }

    // ---- Decks ----
    public Deck getDeck(DeckColor color) {
        return decks.get(color);
    }

    public Map<DeckColor, Deck> getDecks() {
        return decks;
    }

    /**
     * Put a card on the discard pile of the deck it came from.
     */
    public void discard(Card card) {
        Deck deck = decks.get(card.getDeck());
        if (deck != null) {
            deck.discard(card);
        }
    }

    public GameRng getRng() {
        return rng;
    }

    public WinTracker getWinTracker() {
        return winTracker;
    }

    // ---- Turn info ----
    public int getTurn() {
        return turn;
    }

    void incrementTurn() {
        turn++;
    }

    public Phase getPhase() {
        return phase;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    public Player getCurrentPlayer() {
        return players.get(currentIndex);
    }

    public boolean isStarted() {
        return started;
    }

    void markStarted() {
        this.started = true;
    }

    // ---- Per-turn flags ----
    public boolean hasRolledThisTurn() {
        return rolledThisTurn;
    }

    public int getMovementRoll() {
        return movementRoll;
    }

    void recordMovementRoll(int roll) {
        this.rolledThisTurn = true;
        this.movementRoll = roll;
    }

    public boolean hasMovedThisTurn() {
        return movedThisTurn;
    }

    public void markMoved() {
        this.movedThisTurn = true;
    }

    public boolean hasDrawnThisTurn() {
        return drawnThisTurn;
    }

    void markDrawn() {
        this.drawnThisTurn = true;
    }

    public boolean hasAttackedThisTurn() {
        return attackedThisTurn;
    }

    public void markAttacked() {
        this.attackedThisTurn = true;
    }

    /**
     * Reset per-turn flags for the player about to move.
     */
    void resetTurnState() {
        rolledThisTurn = false;
        movementRoll = 0;
        movedThisTurn = false;
        drawnThisTurn = false;
        attackedThisTurn = false;
    }

    // ---- Outcome ----
    public WinResult getResult() {
        return result;
    }

    public boolean isGameOver() {
        return result.gameOver();
    }

    /**
     * Record the final result. The first game-over result sticks.
     */
    public void finish(WinResult result) {
        if (!this.result.gameOver() && result.gameOver()) {
            this.result = result;
        }
    }
}
