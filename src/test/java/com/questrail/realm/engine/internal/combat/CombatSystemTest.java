package com.questrail.realm.engine.internal.combat;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.engine.internal.effects.EffectSpec;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Stat;
import com.questrail.realm.engine.internal.world.StatBlock;
import com.questrail.realm.engine.observability.CombatTransitionEvent;
import com.questrail.realm.engine.test.EngineHarness;
import com.questrail.realm.engine.test.FixedCombatDice;
import com.questrail.realm.engine.test.TestWorlds;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.questrail.realm.engine.test.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class CombatSystemTest {

    private EngineHarness harness;

    private void start(StatBlock goblinStats, FixedCombatDice dice) {
        harness = new EngineHarness(TestWorlds.square(goblinStats), dice);
        harness.connect(ALICE, BOB);
        harness.drain(ALICE);
        harness.drain(BOB);
    }

    private void start() {
        start(StatBlock.defaults().withMaxHealth(10).withArmorClass(0), new FixedCombatDice(5));
    }

    private Entity alice() {
        return harness.entity(ALICE);
    }

    private Entity goblin() {
        return harness.entity(GOBLIN);
    }

    private CombatSystem combat() {
        return harness.runtime().combat();
    }

    // ---------------------------------------------------------------------
    // Full exchanges
    // ---------------------------------------------------------------------

    @Test
    void shortswordKillsGoblinOnSecondSwing() {
        start();
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");

        assertEquals(CombatPhase.WINDUP, alice().combat().phase());
        assertTrue(harness.texts(ALICE).contains("You begin attacking a goblin with your shortsword... (2.0s)"));

        harness.advanceMillis(1_999);
        assertEquals(10, goblin().currentHealth());

        harness.advanceMillis(1);
        assertEquals(5, goblin().currentHealth());
        assertEquals(CombatPhase.RECOVERY, alice().combat().phase());
        assertEquals(CombatPhase.WINDUP, goblin().combat().phase());
        assertTrue(harness.texts(ALICE, "combat").contains("You hit a goblin for 5 damage!"));

        harness.advanceMillis(500);
        assertEquals(CombatPhase.WINDUP, alice().combat().phase());

        harness.advanceMillis(1_500);
        assertEquals(98, alice().currentHealth());
        assertTrue(harness.texts(ALICE, "combat").contains("a goblin hits you for 2 damage!"));

        harness.advanceMillis(500);
        assertEquals(4_500, harness.nowMillis());
        assertFalse(goblin().isAlive());
        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertEquals(CombatPhase.IDLE, goblin().combat().phase());
        assertTrue(goblin().room().isEmpty());
        assertEquals(1, harness.ctx().scheduler().outstanding());

        assertTrue(harness.texts(BOB, "death").contains("a goblin has been slain by Alice!"));
    }

    @Test
    void nothingHitsAfterDeath() {
        start();
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(4_500);
        harness.drain(ALICE);

        harness.advanceMillis(60_000);

        assertEquals(98, alice().currentHealth());
        assertEquals(0, goblin().currentHealth());
        assertTrue(harness.texts(ALICE, "combat").isEmpty());
    }

    @Test
    void weaponSwapTakesEffectAtNextWindup() {
        start(StatBlock.defaults().withMaxHealth(100).withArmorClass(0), new FixedCombatDice(5));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");

        harness.advanceMillis(1_000);
        harness.command(ALICE, "wield dagger");
        assertEquals("shortsword", alice().combat().snapshot().orElseThrow().name());

        harness.advanceMillis(1_000);
        assertEquals(95, goblin().currentHealth());

        harness.advanceMillis(500);
        WeaponSnapshot next = alice().combat().snapshot().orElseThrow();
        assertEquals("dagger", next.name());
        assertEquals(CombatPhase.WINDUP, alice().combat().phase());

        harness.advanceMillis(1_000);
        assertEquals(92, goblin().currentHealth());
    }

    @Test
    void weaponSwapDuringRecoveryAppliesFromTheFollowingWindup() {
        start(StatBlock.defaults().withMaxHealth(100).withArmorClass(0), new FixedCombatDice(5));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(2_000);
        assertEquals(CombatPhase.RECOVERY, alice().combat().phase());

        harness.advanceMillis(200);
        harness.command(ALICE, "wield dagger");

        harness.advanceMillis(299);
        assertEquals(CombatPhase.RECOVERY, alice().combat().phase());
        assertEquals("shortsword", alice().combat().snapshot().orElseThrow().name());

        harness.advanceMillis(1);
        assertEquals(CombatPhase.WINDUP, alice().combat().phase());
        assertEquals("dagger", alice().combat().snapshot().orElseThrow().name());
        assertEquals(1_000_000_000L, alice().combat().remainingNanos(harness.clock().nowNanos()));
    }

    // ---------------------------------------------------------------------
    // Damage
    // ---------------------------------------------------------------------

    @Test
    void armorReducesDamageButNeverBelowOne() {
        start(StatBlock.defaults().withMaxHealth(50).withArmorClass(10), new FixedCombatDice(5));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(2_000);
        assertEquals(47, goblin().currentHealth());

        start(StatBlock.defaults().withMaxHealth(50).withArmorClass(40), new FixedCombatDice(1));
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(2_000);
        assertEquals(49, goblin().currentHealth());
    }

    @Test
    void strengthModifierAddsToTheRoll() {
        start(StatBlock.defaults().withMaxHealth(50).withArmorClass(0), new FixedCombatDice(5));
        harness.inUnit(() -> harness.runtime().effects().apply(ALICE,
            EffectSpec.statBuff("Giant Strength", Stat.STRENGTH, 6, Duration.ofSeconds(60))));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");

        harness.advanceMillis(2_000);

        assertEquals(42, goblin().currentHealth());
    }

    @Test
    void criticalHitMultipliesAndTruncates() {
        start(StatBlock.defaults().withMaxHealth(50).withArmorClass(0), new FixedCombatDice(5).critical(true));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");

        harness.advanceMillis(2_000);

        assertEquals(43, goblin().currentHealth());
        assertTrue(harness.texts(ALICE, "combat").contains("You hit a goblin for 7 damage! CRITICAL!"));
    }

    // ---------------------------------------------------------------------
    // Ending combat
    // ---------------------------------------------------------------------

    @Test
    void secondAttackerIsResetWhenTheTargetDiesFirst() {
        start(StatBlock.defaults().withMaxHealth(5).withArmorClass(0), new FixedCombatDice(5));
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.command(BOB, "attack goblin");

        harness.advanceMillis(2_000);

        assertFalse(goblin().isAlive());
        assertEquals(CombatPhase.IDLE, harness.entity(BOB).combat().phase());
        assertTrue(harness.entity(BOB).combat().pendingEventId().isEmpty());
        assertTrue(harness.texts(BOB, "combat").stream().noneMatch(t -> t.startsWith("You hit")));
    }

    @Test
    void targetLeavingEndsCombatAtTheNextTransition() {
        start();
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(1_000);
        harness.inUnit(() -> harness.ctx().world().move(goblin(), HALL));

        harness.advanceMillis(1_000);

        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertEquals(10, goblin().currentHealth());
        assertTrue(harness.texts(ALICE, "combat").contains("Your target is no longer here."));
    }

    @Test
    void disengageCancelsThePendingSwing() {
        start();
        harness.command(ALICE, "attack goblin");
        harness.command(ALICE, "stop");

        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertTrue(harness.texts(ALICE).contains("You stop attacking a goblin."));

        harness.advanceMillis(5_000);
        assertEquals(10, goblin().currentHealth());
    }

    @Test
    void movingAwayBreaksOffCombat() {
        start();
        harness.command(ALICE, "attack goblin");
        harness.command(ALICE, "north");

        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertEquals(Optional.of(HALL), alice().room());
        assertTrue(harness.texts(ALICE).contains("You break off combat."));
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    @Test
    void disconnectEndsCombatForEveryoneTargetingTheParticipant() {
        start();
        harness.command(BOB, "attack alice");
        assertEquals(CombatPhase.WINDUP, harness.entity(BOB).combat().phase());

        harness.runtime().disconnect(ALICE);
        harness.loop().runUntilIdle();

        assertEquals(CombatPhase.IDLE, harness.entity(BOB).combat().phase());
        assertTrue(harness.texts(BOB, "combat").contains("Alice fades from view. Combat ended."));
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    // ---------------------------------------------------------------------
    // Flee
    // ---------------------------------------------------------------------

    @Test
    void successfulFleeMovesThroughAnExitAndEndsCombat() {
        start(StatBlock.defaults().withMaxHealth(10).withArmorClass(0), new FixedCombatDice(5).d20(20));
        harness.command(ALICE, "attack goblin");

        harness.command(ALICE, "flee");

        assertEquals(Optional.of(HALL), alice().room());
        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertTrue(harness.texts(ALICE, "combat").contains("You flee north! (Roll: 20 +0 DEX = 20 vs DC 15)"));
        assertTrue(harness.texts(BOB).contains("Alice flees north!"));
    }

    @Test
    void failedFleeKeepsFighting() {
        start(StatBlock.defaults().withMaxHealth(10).withArmorClass(0), new FixedCombatDice(5).d20(1));
        harness.command(ALICE, "attack goblin");

        harness.command(ALICE, "flee");

        assertEquals(Optional.of(SQUARE), alice().room());
        assertEquals(CombatPhase.WINDUP, alice().combat().phase());
        assertTrue(harness.texts(ALICE, "combat").contains("You fail to escape! (Roll: 1 +0 DEX = 1 vs DC 15)"));
    }

    @Test
    void fleeGetsEasierAsHealthDrops() {
        start();
        Entity a = alice();
        assertEquals(15, combat().fleeDifficulty(a));
        a.damage(50, 0);
        assertEquals(10, combat().fleeDifficulty(a));
        a.damage(49, 0);
        assertEquals(6, combat().fleeDifficulty(a));
        a.damage(1, 0);
        assertEquals(5, combat().fleeDifficulty(a));
    }

    // ---------------------------------------------------------------------
    // Death and respawn
    // ---------------------------------------------------------------------

    @Test
    void slainNpcReturnsAfterRespawnDelay() {
        start();
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(4_500);
        assertTrue(goblin().room().isEmpty());

        harness.advanceMillis(299_999);
        assertTrue(goblin().room().isEmpty());

        harness.advanceMillis(1);
        assertEquals(Optional.of(SQUARE), goblin().room());
        assertEquals(10, goblin().currentHealth());
        assertTrue(harness.texts(BOB).contains("a goblin appears."));
        assertEquals(0, harness.ctx().scheduler().outstanding());
    }

    @Test
    void slainParticipantStaysDeadUntilRespawnCommand() {
        start();
        harness.inUnit(() -> alice().damage(99, 0));
        harness.inUnit(() -> combat().engage(goblin(), alice()));
        harness.drain(ALICE);

        harness.advanceMillis(2_000);

        assertFalse(alice().isAlive());
        assertEquals(Optional.of(SQUARE), alice().room());
        assertEquals(CombatPhase.IDLE, goblin().combat().phase());
        assertTrue(harness.texts(ALICE, "death").contains("You have been slain! (Use 'respawn' to return)"));

        harness.command(ALICE, "north");
        assertEquals(List.of("You can't move while dead."), harness.texts(ALICE, "error"));

        harness.command(ALICE, "respawn");
        assertTrue(alice().isAlive());
        assertEquals(100, alice().currentHealth());
        assertTrue(harness.texts(ALICE).contains("You return to the living."));

        harness.command(ALICE, "respawn");
        assertEquals(List.of("You are not dead."), harness.texts(ALICE, "error"));
    }

    @Test
    void effectsAreClearedOnDeath() {
        start();
        harness.command(ALICE, "bless goblin");
        assertFalse(goblin().effects().isEmpty());
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");

        harness.advanceMillis(7_000);

        assertFalse(goblin().isAlive());
        assertTrue(goblin().effects().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Refusals and status
    // ---------------------------------------------------------------------

    @Test
    void engageRefusals() {
        start();
        assertEquals(Optional.of("You can't attack yourself!"), combat().engageRefusal(alice(), alice()));

        harness.command(ALICE, "attack goblin");
        assertEquals(Optional.of("You're already attacking a goblin! Use 'stop' to disengage first."),
            combat().engageRefusal(alice(), harness.entity(BOB)));
        assertThrows(IllegalStateException.class, () -> combat().engage(alice(), harness.entity(BOB)));

        harness.drain(ALICE);
        harness.command(ALICE, "attack bob");
        assertEquals(List.of("You're already attacking a goblin! Use 'stop' to disengage first."),
            harness.texts(ALICE, "error"));

        harness.command(BOB, "north");
        assertEquals(Optional.of("Your target cannot be found."),
            combat().engageRefusal(harness.entity(CAROL), harness.entity(BOB)));
    }

    @Test
    void idleTargetRetaliates() {
        start(StatBlock.defaults().withMaxHealth(100).withArmorClass(0), new FixedCombatDice(5));
        harness.command(ALICE, "attack goblin");

        harness.advanceMillis(2_000);

        assertEquals(CombatPhase.WINDUP, goblin().combat().phase());
        assertEquals(Optional.of(ALICE), goblin().combat().target());
    }

    @Test
    void statusReportsPhaseAndWeapon() {
        start();
        assertEquals("You are not in combat.", combat().status(alice()));

        harness.command(ALICE, "wield dagger");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(400);

        String status = combat().status(alice());
        assertTrue(status.contains("Target: a goblin (100% health)"));
        assertTrue(status.contains("Phase: windup (0.6s remaining)"));
        assertTrue(status.contains("Weapon: dagger, 1-3 physical damage, 1.0s speed"));
    }

    @Test
    void transitionsAreReportedToTheSink() {
        start();
        harness.command(ALICE, "attack goblin");
        harness.command(ALICE, "stop");

        List<CombatTransitionEvent> transitions = harness.sink().eventsOfType(CombatTransitionEvent.class);
        assertEquals(2, transitions.size());
        assertEquals(CombatPhase.IDLE, transitions.get(0).from());
        assertEquals(CombatPhase.WINDUP, transitions.get(0).to());
        assertEquals(CombatPhase.IDLE, transitions.get(1).to());
    }

    // ---------------------------------------------------------------------
    // Experience
    // ---------------------------------------------------------------------

    @Test
    void slayingAnNpcAwardsItsExperience() {
        harness = new EngineHarness(
            TestWorlds.square(StatBlock.defaults().withMaxHealth(10).withArmorClass(0), 25),
            new FixedCombatDice(5));
        harness.connect(ALICE);
        harness.drain(ALICE);

        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(4_500);

        assertFalse(goblin().isAlive());
        assertEquals(25, alice().experience());
        assertTrue(harness.texts(ALICE, "message").contains("You gain 25 experience!"));
    }

    @Test
    void npcWithoutRewardGivesNothing() {
        start();
        harness.command(ALICE, "wield shortsword");
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(4_500);

        assertFalse(goblin().isAlive());
        assertEquals(0, alice().experience());
    }

    // ---------------------------------------------------------------------
    // Removal
    // ---------------------------------------------------------------------

    @Test
    void removingTargetMidWindupReturnsAttackerToIdle() {
        start();
        harness.command(ALICE, "attack goblin");
        harness.advanceMillis(1_000);

        harness.inUnit(() -> assertTrue(combat().removeEntity(GOBLIN)));

        assertTrue(harness.ctx().world().entity(GOBLIN).isEmpty());
        assertEquals(CombatPhase.IDLE, alice().combat().phase());
        assertTrue(alice().combat().pendingEventId().isEmpty());
        assertTrue(harness.texts(ALICE, "combat").contains("a goblin is gone. Combat ended."));
        assertEquals(0, harness.ctx().scheduler().outstanding());

        harness.advanceMillis(10_000);
        assertEquals(100, alice().currentHealth());
        assertTrue(harness.sink().getErrors().isEmpty());
    }

    @Test
    void removingAttackerCancelsItsSwingAndEffects() {
        start();
        harness.command(ALICE, "bless");
        harness.command(ALICE, "attack goblin");
        harness.drain(BOB);

        harness.inUnit(() -> assertTrue(combat().removeEntity(ALICE)));

        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertFalse(harness.ctx().dispatcher().isRegistered(ALICE));
        assertEquals(List.of("Alice vanishes."), harness.texts(BOB));

        harness.advanceMillis(10_000);
        assertEquals(10, goblin().currentHealth());
        assertEquals(CombatPhase.IDLE, goblin().combat().phase());
        assertTrue(harness.sink().getErrors().isEmpty());
    }

    @Test
    void pendingWindupForAnEntityGoneFromTheWorldDoesNothing() {
        start();
        harness.command(ALICE, "attack goblin");

        harness.ctx().world().remove(ALICE);
        harness.advanceMillis(5_000);

        assertEquals(10, goblin().currentHealth());
        assertEquals(0, harness.ctx().scheduler().outstanding());
        assertTrue(harness.sink().getErrors().isEmpty());
    }

    @Test
    void removingUnknownEntityReportsFalse() {
        start();
        harness.inUnit(() -> assertFalse(combat().removeEntity(EntityId.of("nobody"))));
    }
}
