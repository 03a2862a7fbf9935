package com.shadowhunters.engine.rng;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameRng.
 */
class GameRngTest {

    @Test
    void testSameSeedProducesSameSequence() {
        GameRng rng1 = new GameRng(12345);
        GameRng rng2 = new GameRng(12345);

        for (int i = 0; i < 100; i++) {
            assertEquals(rng1.next(), rng2.next(), "Same seed should produce same random sequence");
        }
    }

    @Test
    void testShuffleReproducibility() {
        List<Integer> arr1 = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));
        List<Integer> arr2 = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

        new GameRng(42).shuffle(arr1);
        new GameRng(42).shuffle(arr2);

        assertEquals(arr1, arr2, "Same seed should produce same shuffle");
    }

    /**
     * Known Mulberry32 output for seed 12345.
     */
    @Test
    void testMulberry32KnownValues() {
        double[] expected = {
            0.9797282677609473,
            0.3067522644996643,
            0.484205421525985,
            0.817934412509203,
            0.5094283693470061
        };

        GameRng rng = new GameRng(12345);
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], rng.next(), 1e-15, "Value " + i + " mismatch");
        }
    }

    @Test
    void testRollStaysOnTheDie() {
        GameRng rng = new GameRng(99);
        boolean sawOne = false;
        boolean sawSix = false;
        for (int i = 0; i < 1000; i++) {
            int roll = rng.roll(6);
            assertTrue(roll >= 1 && roll <= 6, "d6 roll out of range: " + roll);
            sawOne |= roll == 1;
            sawSix |= roll == 6;
        }
        assertTrue(sawOne && sawSix, "Both faces of the range should come up");
    }

    @Test
    void testNextIntRejectsEmptyBound() {
        assertThrows(IllegalArgumentException.class, () -> new GameRng(1).nextInt(0));
    }

    @Test
    void testPick() {
        GameRng rng = new GameRng(5);
        assertNull(rng.pick(List.of()));
        assertEquals("only", rng.pick(List.of("only")));
    }
}
