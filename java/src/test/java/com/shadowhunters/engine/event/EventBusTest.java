package com.shadowhunters.engine.event;

import com.shadowhunters.engine.Fixtures;
import com.shadowhunters.engine.game.Player;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventBus.
 */
class EventBusTest {

    @Test
    void testListenersRunInSubscriptionOrder() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        bus.subscribe(e -> calls.add("first"));
        bus.subscribe(e -> calls.add("second"));

        bus.publish(new GameEvent.TurnStarted(Fixtures.player(0, "emi"), 1));
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void testNestedEventsAreDeliveredDepthFirst() {
        EventBus bus = new EventBus();
        Player emi = Fixtures.player(0, "emi");
        List<String> calls = new ArrayList<>();
        bus.subscribe(e -> {
            calls.add("a:" + e.getClass().getSimpleName());
            if (e instanceof GameEvent.TurnStarted) {
                bus.publish(new GameEvent.CharacterRevealed(emi, false));
            }
        });
        bus.subscribe(e -> calls.add("b:" + e.getClass().getSimpleName()));

        bus.publish(new GameEvent.TurnStarted(emi, 1));
        assertEquals(List.of(
            "a:TurnStarted",
            "a:CharacterRevealed",
            "b:CharacterRevealed",
            "b:TurnStarted"
        ), calls);
    }

    @Test
    void testUnsubscribeDuringDelivery() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        GameEventListener once = new GameEventListener() {
            @Override
            public void onEvent(GameEvent event) {
                calls.add("once");
                bus.unsubscribe(this);
            }
        };
        bus.subscribe(once);
        bus.publish(new GameEvent.TurnStarted(Fixtures.player(0, "emi"), 1));
        bus.publish(new GameEvent.TurnStarted(Fixtures.player(0, "emi"), 2));
        assertEquals(List.of("once"), calls);
        assertEquals(0, bus.listenerCount());
    }
}
