package com.questrail.realm.engine.internal.effects;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Stat;
import com.questrail.realm.engine.test.EngineHarness;
import com.questrail.realm.engine.test.FixedCombatDice;
import com.questrail.realm.engine.test.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.questrail.realm.engine.test.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class EffectSystemTest {

    private EngineHarness harness;
    private EffectSystem effects;
    private Entity alice;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(TestWorlds.square(), new FixedCombatDice(3));
        harness.connect(ALICE);
        harness.drain(ALICE);
        effects = harness.runtime().effects();
        alice = harness.entity(ALICE);
    }

    private EffectId apply(EffectSpec spec) {
        List<EffectId> id = new ArrayList<>();
        harness.inUnit(() -> id.add(effects.apply(ALICE, spec).orElseThrow()));
        return id.get(0);
    }

    @Test
    void poisonTicksFiveTimesThenWearsOffExactlyOnce() {
        apply(EffectSpec.poison());
        assertEquals(List.of("You are afflicted by Poison. (5 damage every 3.0s for 15s)"),
            harness.texts(ALICE, "effect"));

        harness.advanceMillis(14_999);
        assertEquals(80, alice.currentHealth());
        assertEquals(4, harness.texts(ALICE, "effect").size());

        harness.advanceMillis(1);
        assertEquals(75, alice.currentHealth());
        assertEquals(List.of("You take 5 poison damage.", "Poison wears off."),
            harness.texts(ALICE, "effect"));
        assertTrue(alice.effects().isEmpty());
        assertEquals(0, harness.ctx().scheduler().outstanding());

        harness.advanceMillis(30_000);
        assertEquals(75, alice.currentHealth());
        assertTrue(harness.texts(ALICE, "effect").isEmpty());
    }

    @Test
    void damageOverTimeNeverKills() {
        apply(EffectSpec.damageOverTime("Venom", 50, Duration.ofSeconds(1), Duration.ofSeconds(5)));

        harness.advanceMillis(5_000);

        assertEquals(1, alice.currentHealth());
        assertTrue(alice.isAlive());
        assertFalse(alice.combat().inCombat());
    }

    @Test
    void healOverTimeStopsAtMaxHealth() {
        harness.inUnit(() -> alice.damage(12, 0));
        apply(EffectSpec.healOverTime("Regeneration", 5, Duration.ofSeconds(2), Duration.ofSeconds(10)));

        harness.advanceMillis(10_000);

        assertEquals(100, alice.currentHealth());
    }

    @Test
    void blessingRaisesArmorClassUntilItExpires() {
        apply(EffectSpec.blessing());
        assertEquals(15, alice.effectiveStat(Stat.ARMOR_CLASS));

        harness.advanceMillis(29_999);
        assertEquals(15, alice.effectiveStat(Stat.ARMOR_CLASS));

        harness.advanceMillis(1);
        assertEquals(10, alice.effectiveStat(Stat.ARMOR_CLASS));
        assertTrue(harness.texts(ALICE, "effect").contains("Blessing wears off."));
    }

    @Test
    void cancellingExpirationKeepsTheModifierIndefinitely() {
        EffectId blessing = apply(EffectSpec.blessing());
        harness.advanceMillis(1_000);

        assertTrue(effects.cancelExpiration(ALICE, blessing));
        assertFalse(effects.cancelExpiration(ALICE, blessing));

        harness.advanceMillis(120_000);
        assertEquals(15, alice.effectiveStat(Stat.ARMOR_CLASS));
        assertTrue(alice.effect(blessing).isPresent());
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    @Test
    void removeCancelsBothTickAndExpiration() {
        EffectId poison = apply(EffectSpec.poison());
        harness.advanceMillis(4_000);
        assertEquals(95, alice.currentHealth());

        harness.inUnit(() -> assertTrue(effects.remove(ALICE, poison)));
        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertFalse(effects.remove(ALICE, poison));

        harness.advanceMillis(20_000);
        assertEquals(95, alice.currentHealth());
        assertFalse(harness.texts(ALICE, "effect").contains("Poison wears off."));
    }

    @Test
    void stackedEffectsSumTheirModifiers() {
        apply(EffectSpec.blessing());
        apply(EffectSpec.statBuff("Stoneskin", Stat.ARMOR_CLASS, 3, Duration.ofSeconds(10)));
        apply(EffectSpec.statBuff("Weakness", Stat.STRENGTH, -4, Duration.ofSeconds(10)));

        assertEquals(18, alice.effectiveStat(Stat.ARMOR_CLASS));
        assertEquals(6, alice.effectiveStat(Stat.STRENGTH));

        harness.advanceMillis(10_000);
        assertEquals(15, alice.effectiveStat(Stat.ARMOR_CLASS));
        assertEquals(10, alice.effectiveStat(Stat.STRENGTH));
    }

    @Test
    void clearAllDropsEverythingSilently() {
        apply(EffectSpec.blessing());
        apply(EffectSpec.poison());
        harness.drain(ALICE);

        harness.inUnit(() -> effects.clearAll(alice));

        assertTrue(alice.effects().isEmpty());
        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertTrue(harness.drain(ALICE).isEmpty());
    }

    @Test
    void deadOrUnknownEntitiesCannotReceiveEffects() {
        harness.inUnit(() -> alice.damage(1_000, 0));

        assertEquals(Optional.empty(), effects.apply(ALICE, EffectSpec.blessing()));
        assertEquals(Optional.empty(), effects.apply(EntityId.of("nobody"), EffectSpec.blessing()));
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    @Test
    void summaryListsRemainingTimeAndModifiers() {
        assertEquals("You have no active effects.", effects.summary(alice));

        apply(EffectSpec.blessing());
        harness.advanceMillis(10_000);

        String summary = effects.summary(alice);
        assertTrue(summary.startsWith("Active effects:"));
        assertTrue(summary.contains("Blessing (buff), 20.0s remaining, armor_class +5"));
    }

    @Test
    void periodicSpecsRequireAnInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> EffectSpec.damageOverTime("Bad", 5, Duration.ZERO, Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class,
            () -> EffectSpec.statBuff("Bad", Stat.STRENGTH, 1, Duration.ZERO));
    }

    @Test
    void callbacksForAnEntityGoneFromTheWorldDoNothing() {
        apply(EffectSpec.poison());
        harness.drain(ALICE);

        harness.ctx().world().remove(ALICE);
        harness.advanceMillis(20_000);

        assertEquals(100, alice.currentHealth());
        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertTrue(harness.sink().getErrors().isEmpty());
        assertTrue(harness.texts(ALICE).isEmpty());
    }
}
