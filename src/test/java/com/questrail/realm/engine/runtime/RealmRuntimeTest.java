package com.questrail.realm.engine.runtime;

import com.questrail.realm.api.EngineStatus;
import com.questrail.realm.engine.config.EngineConfig;
import com.questrail.realm.engine.internal.combat.CombatPolicy;
import com.questrail.realm.engine.observability.EngineLifecycleEvent;
import com.questrail.realm.engine.observability.RecordingObservabilitySink;
import com.questrail.realm.engine.test.RecordingPersistence;
import com.questrail.realm.engine.test.TestWorlds;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RealmRuntimeTest {

    @Test
    void fullStackLifecycle() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        RecordingPersistence persistence = new RecordingPersistence();
        RealmRuntime runtime = RealmRuntime.builder()
            .withWorld(TestWorlds.square())
            .withConfig(EngineConfig.builder().withMaxPollInterval(Duration.ofMillis(50)).build())
            .withPersistence(persistence)
            .withObservabilitySink(sink)
            .build();

        assertEquals(EngineStatus.NEW, runtime.status());
        runtime.start();
        assertTrue(runtime.connect(TestWorlds.ALICE));
        Thread.sleep(200);
        runtime.stop();

        assertEquals(EngineStatus.STOPPED, runtime.status());
        assertFalse(runtime.enqueueCommand(TestWorlds.ALICE, "look"));
        assertEquals(1, persistence.flushes().size());
        assertTrue(persistence.flushes().get(0).contains(TestWorlds.ALICE));
        assertEquals(3, sink.eventsOfType(EngineLifecycleEvent.class).size());
    }

    @Test
    void stopBeforeStartStillDrains() {
        RecordingPersistence persistence = new RecordingPersistence();
        RealmRuntime runtime = RealmRuntime.builder()
            .withWorld(TestWorlds.square())
            .withPersistence(persistence)
            .withObservabilitySink(new RecordingObservabilitySink())
            .build();

        runtime.stop();

        assertEquals(EngineStatus.STOPPED, runtime.status());
        assertEquals(1, persistence.flushes().size());
        assertTrue(persistence.flushes().get(0).isEmpty());
    }

    @Test
    void stopRightAfterStartEndsStopped() {
        for (int i = 0; i < 25; i++) {
            RecordingObservabilitySink sink = new RecordingObservabilitySink();
            RealmRuntime runtime = RealmRuntime.builder()
                .withWorld(TestWorlds.square())
                .withPersistence(new RecordingPersistence())
                .withObservabilitySink(sink)
                .build();

            runtime.start();
            assertEquals(EngineStatus.RUNNING, runtime.status());
            runtime.stop();

            assertEquals(EngineStatus.STOPPED, runtime.status(), "iteration " + i);
            List<EngineStatus> transitions = sink.eventsOfType(EngineLifecycleEvent.class).stream()
                .map(EngineLifecycleEvent::to)
                .collect(Collectors.toList());
            assertEquals(List.of(EngineStatus.RUNNING, EngineStatus.DRAINING, EngineStatus.STOPPED),
                transitions, "iteration " + i);
        }
    }

    @Test
    void startAfterStopDoesNothing() {
        RealmRuntime runtime = RealmRuntime.builder()
            .withWorld(TestWorlds.square())
            .withObservabilitySink(new RecordingObservabilitySink())
            .build();

        runtime.stop();
        runtime.start();

        assertEquals(EngineStatus.STOPPED, runtime.status());
        assertFalse(runtime.loop().isStarted());
    }

    @Test
    void worldIsRequired() {
        assertThrows(NullPointerException.class, () -> RealmRuntime.builder().build());
    }

    @Test
    void configValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.builder().withMaxPollInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> CombatPolicy.defaults().withCriticalChance(1.5));
        assertThrows(IllegalArgumentException.class, () -> CombatPolicy.defaults().withCriticalMultiplier(0.5));
        assertThrows(IllegalArgumentException.class,
            () -> CombatPolicy.defaults().withRecoveryDelay(Duration.ofMillis(-1)));

        EngineConfig defaults = EngineConfig.defaults();
        assertEquals(Duration.ofMillis(500), defaults.maxPollInterval());
        assertEquals(Duration.ofSeconds(300), defaults.combatPolicy().npcRespawnDelay());
    }
}
