package com.questrail.realm.engine.runtime;

import com.questrail.realm.api.EngineStatus;
import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RealmEngine;
import com.questrail.realm.engine.config.EngineConfig;
import com.questrail.realm.engine.internal.combat.CombatDice;
import com.questrail.realm.engine.internal.combat.CombatSystem;
import com.questrail.realm.engine.internal.combat.RandomCombatDice;
import com.questrail.realm.engine.internal.command.CommandProcessor;
import com.questrail.realm.engine.internal.command.CommandQueue;
import com.questrail.realm.engine.internal.command.CommandRegistry;
import com.questrail.realm.engine.internal.command.StandardCommands;
import com.questrail.realm.engine.internal.dispatch.DeliveryListener;
import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.effects.EffectSystem;
import com.questrail.realm.engine.internal.effects.RegenerationSystem;
import com.questrail.realm.engine.internal.exec.DirtyTracker;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.exec.EngineLoop;
import com.questrail.realm.engine.internal.time.MonotonicClock;
import com.questrail.realm.engine.internal.time.SystemMonotonicClock;
import com.questrail.realm.engine.internal.time.SystemWallClock;
import com.questrail.realm.engine.internal.time.TimedCallbackScheduler;
import com.questrail.realm.engine.internal.time.WallClock;
import com.questrail.realm.engine.internal.world.World;
import com.questrail.realm.engine.observability.EngineObservabilitySink;
import com.questrail.realm.engine.observability.Slf4jEngineObservabilitySink;
import com.questrail.realm.engine.persistence.NullPersistenceCollaborator;
import com.questrail.realm.engine.persistence.PersistenceCollaborator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RealmRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one engine instance.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring and ownership component only</strong>. It builds
 * the {@link EngineContext}, the systems that share it, the verb registry and the
 * {@link EngineLoop}, and exposes them to transport code through the narrow
 * {@link RealmEngine} boundary.
 *
 * <p>No game rules live here.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()            → regeneration scheduled, engine loop thread running
 *   runtime.requestShutdown()  → loop finishes its unit, drains, exits
 *   runtime.stop()             → requestShutdown() and wait
 * </pre>
 */
public final class RealmRuntime implements RealmEngine
{
    private final EngineContext context;
    private final CommandQueue commands;
    private final CommandRegistry registry;
    private final CombatSystem combat;
    private final EffectSystem effects;
    private final RegenerationSystem regeneration;
    private final EngineLoop loop;

    private RealmRuntime(EngineContext context,
                         CommandQueue commands,
                         CommandRegistry registry,
                         CombatSystem combat,
                         EffectSystem effects,
                         RegenerationSystem regeneration,
                         EngineLoop loop)
    {
        this.context = context;
        this.commands = commands;
        this.registry = registry;
        this.combat = combat;
        this.effects = effects;
        this.regeneration = regeneration;
        this.loop = loop;
    }

    /**
     * Schedules regeneration and starts the loop thread. The scheduler is
     * touched here only before the loop thread exists.
     */
    public synchronized void start() {
        if (loop.isStarted() || loop.isShutdownRequested()) {
            return;
        }
        regeneration.start();
        loop.start();
    }

    /**
     * Requests shutdown and waits for the loop to drain. If the loop never ran,
     * the drain pass runs on the calling thread.
     */
    public void stop() {
        if (!loop.isStarted()) {
            loop.completeShutdown();
            return;
        }
        loop.stop();
    }

    public void setDeliveryListener(DeliveryListener listener) {
        context.dispatcher().setDeliveryListener(listener);
    }

    /**
     * The loop itself, for single-threaded driving with {@code step()}.
     */
    public EngineLoop loop() {
        return loop;
    }

    public EngineContext context() {
        return context;
    }

    public CommandRegistry registry() {
        return registry;
    }

    public CombatSystem combat() {
        return combat;
    }

    public EffectSystem effects() {
        return effects;
    }

    public RegenerationSystem regeneration() {
        return regeneration;
    }

    // -------------------------------------------------------------------------
    // RealmEngine
    // -------------------------------------------------------------------------

    @Override
    public boolean enqueueCommand(EntityId sourceId, String text) {
        return commands.enqueue(sourceId, text).isPresent();
    }

    @Override
    public boolean connect(EntityId participantId) {
        return commands.enqueueConnect(participantId).isPresent();
    }

    @Override
    public boolean disconnect(EntityId participantId) {
        return commands.enqueueDisconnect(participantId).isPresent();
    }

    @Override
    public List<Delivery> drain(EntityId participantId) {
        List<OutboundEvent> events = context.dispatcher().drain(participantId);
        List<Delivery> deliveries = new ArrayList<>(events.size());
        for (OutboundEvent e : events) {
            deliveries.add(new Delivery(e.kind().wireName(), e.text(), e.payload()));
        }
        return deliveries;
    }

    @Override
    public void requestShutdown() {
        loop.requestShutdown();
    }

    @Override
    public EngineStatus status() {
        return loop.status();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private World world;
        private EngineConfig config = EngineConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private CombatDice dice = new RandomCombatDice();
        private PersistenceCollaborator persistence = NullPersistenceCollaborator.INSTANCE;
        private EngineObservabilitySink observabilitySink = new Slf4jEngineObservabilitySink();

        public Builder withWorld(World world) {
            this.world = world;
            return this;
        }

        public Builder withConfig(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withDice(CombatDice dice) {
            this.dice = Objects.requireNonNull(dice, "dice");
            return this;
        }

        public Builder withPersistence(PersistenceCollaborator persistence) {
            this.persistence = Objects.requireNonNull(persistence, "persistence");
            return this;
        }

        public Builder withObservabilitySink(EngineObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public RealmRuntime build() {
            Objects.requireNonNull(world, "world");

            // ---------------------------------------------------------------------
            // Shared state
            // ---------------------------------------------------------------------
            EngineContext context = new EngineContext(
                    clock,
                    wallClock,
                    new TimedCallbackScheduler(clock),
                    world,
                    new EventDispatcher(world),
                    new DirtyTracker(persistence),
                    observabilitySink);

            // ---------------------------------------------------------------------
            // Systems
            // ---------------------------------------------------------------------
            EffectSystem effects = new EffectSystem(context);
            CombatSystem combat = new CombatSystem(context, config.combatPolicy(), dice, effects);
            RegenerationSystem regeneration = new RegenerationSystem(context, config.regeneration());

            // ---------------------------------------------------------------------
            // Verbs, resolved once before the loop exists
            // ---------------------------------------------------------------------
            CommandRegistry registry = new CommandRegistry();
            new StandardCommands(context, combat, effects, registry).install();

            // ---------------------------------------------------------------------
            // Loop
            // ---------------------------------------------------------------------
            CommandQueue commands = new CommandQueue(clock);
            EngineLoop loop = new EngineLoop(context,
                    commands,
                    new CommandProcessor(context, registry, combat),
                    config.maxPollInterval());

            return new RealmRuntime(context, commands, registry, combat, effects, regeneration, loop);
        }
    }
}
