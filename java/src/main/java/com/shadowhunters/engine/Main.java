package com.shadowhunters.engine;

import com.shadowhunters.engine.card.CardDatabase;
import com.shadowhunters.engine.card.CardDatabaseException;
import com.shadowhunters.engine.character.CharacterCatalog;
import com.shadowhunters.engine.character.CharacterCatalogException;
import com.shadowhunters.engine.character.CharacterData;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.simulation.GameConfig;
import com.shadowhunters.engine.simulation.GameResult;
import com.shadowhunters.engine.simulation.GameSetup;
import com.shadowhunters.engine.simulation.GameSetupException;
import com.shadowhunters.engine.simulation.SimulationEngine;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * Shadow Hunters CLI - Main entry point.
 */
@Command(name = "shadow-hunters",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Shadow Hunters rule engine and bot simulator",
        subcommands = {
                Main.SimulateCommand.class,
                Main.CharactersCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Play games between bots")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-p", "--players"}, defaultValue = "5",
                description = "Players per game (4-8)")
        int players;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (single game trace)")
        boolean verbose;

        @Option(names = {"-t", "--max-turns"},
                description = "Rounds before a game is abandoned")
        Integer maxTurns;

        @Option(names = {"-c", "--characters"},
                description = "Path to a character catalog (default: bundled)")
        String charactersPath;

        @Option(names = {"--cards"},
                description = "Path to a card database (default: bundled)")
        String cardsPath;

        @Override
        public Integer call() throws Exception {
            GameConfig config = GameConfig.defaults();
            if (maxTurns != null) {
                config = config.withMaxTurns(maxTurns);
            }

            CharacterCatalog catalog;
            try {
                catalog = charactersPath != null
                        ? CharacterCatalog.fromFile(charactersPath)
                        : CharacterCatalog.fromResource(config.charactersResource());
                System.err.println("✓ Loaded " + catalog.size() + " characters");
            } catch (CharacterCatalogException e) {
                System.err.println("✗ Failed to load characters: " + e.getMessage());
                return 1;
            }

            CardDatabase db;
            try {
                db = cardsPath != null ? CardDatabase.fromFile(cardsPath) : CardDatabase.fromResource(config.cardsResource());
                System.err.println("✓ Loaded " + db.cardCount() + " cards");
            } catch (CardDatabaseException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            System.out.println("\n=== Shadow Hunters Simulator ===\n");
            System.out.println("Players: " + players);
            System.out.println("Games: " + numGames);
            if (seed != null) {
                System.out.println("Seed: " + seed);
            }
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<GameResult> results;
            try {
                results = runSimulations(catalog, db, config, numGames, players, seed, verbose);
            } catch (GameSetupException e) {
                System.err.println("✗ Failed to set up games: " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numGames, elapsed);
            return 0;
        }
    }

    // ========== CHARACTERS COMMAND ==========
    @Command(name = "characters", description = "List the character catalog")
    static class CharactersCommand implements Callable<Integer> {
        @Option(names = {"-c", "--characters"},
                description = "Path to a character catalog (default: bundled)")
        String charactersPath;

        @Override
        public Integer call() throws Exception {
            CharacterCatalog catalog;
            try {
                catalog = charactersPath != null
                        ? CharacterCatalog.fromFile(charactersPath)
                        : CharacterCatalog.fromResource(GameConfig.defaults().charactersResource());
            } catch (CharacterCatalogException e) {
                System.err.println("✗ Failed to load characters: " + e.getMessage());
                return 1;
            }

            for (Faction faction : Faction.values()) {
                System.out.println("\n" + faction.getJsonValue().toUpperCase() + "S");
                for (CharacterData data : catalog.byFaction(faction)) {
                    System.out.printf("  %-12s %2d hp  %-8s %s%n",
                            data.getName(), data.getHp(),
                            data.getAbility().getKind().getJsonValue(),
                            data.getAbility().getName());
                }
            }
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Run simulations and return results.
     */
    private static List<GameResult> runSimulations(CharacterCatalog catalog, CardDatabase db, GameConfig config,
                                                   int count, int players, Long seed, boolean verbose)
            throws GameSetupException {
        if (seed != null || verbose) {
            // Sequential so the seeds are reproducible
            long baseSeed = seed != null ? seed : System.nanoTime();
            if (seed == null) {
                System.out.println("Seed: " + baseSeed);
            }
            List<GameResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                boolean verboseThisGame = verbose && i == 0;
                results.add(SimulationEngine.runGame(catalog, db, players, baseSeed + i, config, verboseThisGame));
            }
            return results;
        }
        // Fail fast on a bad table size before going parallel
        GameSetup.composition(players);
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> runQuietly(catalog, db, players, System.nanoTime() + i, config))
                .filter(Objects::nonNull)
                .toList();
    }

    private static GameResult runQuietly(CharacterCatalog catalog, CardDatabase db, int players,
                                         long gameSeed, GameConfig config) {
        try {
            return SimulationEngine.runGame(catalog, db, players, gameSeed, config, false);
        } catch (GameSetupException e) {
            System.err.println("Skipping game " + gameSeed + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Print simulation results.
     */
    private static void printResults(List<GameResult> results, int numGames, long elapsedMs) {
        long finished = results.stream().filter(GameResult::finished).count();
        double avgTurns = results.stream().filter(GameResult::finished)
                .mapToInt(GameResult::turns).average().orElse(0.0);

        Map<String, Long> byFaction = new TreeMap<>();
        Map<String, Long> byCharacter = new TreeMap<>();
        for (GameResult r : results) {
            if (!r.finished()) {
                continue;
            }
            String faction = r.hasFactionWinner() ? r.winningFaction().getJsonValue() : "none";
            byFaction.merge(faction, 1L, Long::sum);
            for (String winner : r.winners()) {
                byCharacter.merge(winner, 1L, Long::sum);
            }
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Finished: %.1f%% (%d/%d)%n", finished * 100.0 / numGames, finished, numGames);
        System.out.printf("Average game length: %.2f turns%n", avgTurns);
        System.out.println();

        System.out.println("Winning faction:");
        for (Map.Entry<String, Long> entry : byFaction.entrySet()) {
            double pct = (double) entry.getValue() / numGames * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %-8s %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println("\nWins by character:");
        byCharacter.entrySet().stream()
                .sorted((a, b) -> Long.compare(b.getValue(), a.getValue()))
                .forEach(e -> System.out.printf("  %-12s %d%n", e.getKey(), e.getValue()));

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? numGames / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }
}
