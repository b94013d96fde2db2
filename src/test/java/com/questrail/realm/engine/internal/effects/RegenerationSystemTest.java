package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.engine.config.EngineConfig;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.test.EngineHarness;
import com.questrail.realm.engine.test.FixedCombatDice;
import com.questrail.realm.engine.test.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.questrail.realm.engine.test.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class RegenerationSystemTest {

    private EngineHarness harness;
    private RegenerationSystem regeneration;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(TestWorlds.square(), new FixedCombatDice(3));
        harness.connect(ALICE, BOB);
        harness.drain(ALICE);
        harness.drain(BOB);
        regeneration = harness.runtime().regeneration();
    }

    @Test
    void restingEntityHealsOnEveryIntervalUpToMax() {
        Entity alice = harness.entity(ALICE);
        alice.damage(10, 0);
        regeneration.start();

        harness.advanceMillis(9_999);
        assertEquals(90, alice.currentHealth());

        harness.advanceMillis(1);
        assertEquals(92, alice.currentHealth());
        assertEquals(1, harness.texts(ALICE, "stat_update").size());

        harness.advanceMillis(40_000);
        assertEquals(100, alice.currentHealth());
        assertEquals(1, harness.ctx().scheduler().outstanding());
    }

    @Test
    void entitiesAtFullHealthHearNothing() {
        regeneration.start();

        harness.advanceMillis(30_000);

        assertTrue(harness.drain(ALICE).isEmpty());
        assertTrue(harness.drain(BOB).isEmpty());
    }

    @Test
    void fightersAndTheDeadDoNotRegenerate() {
        Entity alice = harness.entity(ALICE);
        Entity bob = harness.entity(BOB);
        Entity carol = harness.entity(CAROL);
        alice.damage(50, 0);
        bob.damage(50, 0);
        carol.damage(100, 0);
        harness.inUnit(() -> harness.runtime().combat().engage(alice, harness.entity(GOBLIN)));

        harness.inUnit(regeneration::tick);

        assertEquals(50, alice.currentHealth());
        assertEquals(52, bob.currentHealth());
        assertEquals(0, carol.currentHealth());
    }

    @Test
    void startIsIdempotentAndStopCancelsTheSeries() {
        assertTrue(regeneration.start());
        assertFalse(regeneration.start());
        assertTrue(regeneration.isRunning());
        assertEquals(1, harness.ctx().scheduler().outstanding());

        regeneration.stop();

        assertFalse(regeneration.isRunning());
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    @Test
    void zeroHealthPerTickNeverSchedules() {
        EngineHarness quiet = new EngineHarness(TestWorlds.square(), new FixedCombatDice(3),
            EngineConfig.builder()
                .withRegeneration(RegenerationPolicy.defaults().withHealthPerTick(0))
                .build());

        assertFalse(quiet.runtime().regeneration().start());
        assertEquals(0, quiet.ctx().scheduler().outstanding());
    }

    @Test
    void policyValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> RegenerationPolicy.defaults().withInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> RegenerationPolicy.defaults().withHealthPerTick(-1));
    }
}
