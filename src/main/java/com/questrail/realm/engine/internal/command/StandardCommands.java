package com.questrail.realm.engine.internal.command;

import com.questrail.realm.api.EntityId;
import com.questrail.realm.api.RoomId;
import com.questrail.realm.engine.internal.combat.CombatSystem;
import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.dispatch.EventKind;
import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.effects.EffectSpec;
import com.questrail.realm.engine.internal.effects.EffectSystem;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.world.Direction;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.internal.world.Room;
import com.questrail.realm.engine.internal.world.WeaponStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * StandardCommands
 * -----------------------------------------------------------------------------
 * The built-in verb set: looking, talking, moving, fighting, equipment, effects
 * and help.
 *
 * <p>Every handler validates first and throws {@link CommandRejectedException}
 * before touching state.</p>
 */
public final class StandardCommands
{
    private final EngineContext ctx;
    private final CombatSystem combat;
    private final EffectSystem effects;
    private final CommandRegistry registry;

    public StandardCommands(EngineContext ctx,
                            CombatSystem combat,
                            EffectSystem effects,
                            CommandRegistry registry)
    {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.combat = Objects.requireNonNull(combat, "combat");
        this.effects = Objects.requireNonNull(effects, "effects");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Registers every built-in verb and returns the registry.
     */
    public CommandRegistry install() {
        registry.register("look", "Information", "Describe the room or someone in it", "look [target]",
                this::look, "l");
        registry.register("say", "Communication", "Speak to everyone in the room", "say <message>",
                this::say);

        for (Direction d : Direction.values()) {
            registry.register(d.label(), "Movement", "Move " + d.label(), d.label(),
                    (actor, args) -> move(actor, d), d.alias());
        }
        registry.register("go", "Movement", "Move in a direction", "go <direction>", this::go);

        registry.register("attack", "Combat", "Start attacking a target", "attack <target>",
                this::attack, "kill", "k");
        registry.register("stop", "Combat", "Stop attacking", "stop", this::stop);
        registry.register("flee", "Combat", "Try to escape through a random exit", "flee", this::flee);
        registry.register("combat", "Combat", "Show your combat status", "combat", this::combatStatus, "cs");
        registry.register("respawn", "Combat", "Return to life at your home room", "respawn", this::respawn);

        registry.register("wield", "Equipment", "Wield a carried weapon", "wield <weapon>", this::wield);
        registry.register("unwield", "Equipment", "Put away your weapon", "unwield", this::unwield);

        registry.register("effects", "Effects", "List your active effects", "effects", this::listEffects,
                "affects");
        registry.register("bless", "Effects", "Bless yourself or someone here", "bless [target]",
                (actor, args) -> applyEffect(actor, args, EffectSpec.blessing()));
        registry.register("poison", "Effects", "Poison yourself or someone here", "poison [target]",
                (actor, args) -> applyEffect(actor, args, EffectSpec.poison()));

        registry.register("help", "Information", "List commands or describe one", "help [command]",
                this::help, "?");
        return registry;
    }

    // ---------------------------------------------------------------------
    // Information
    // ---------------------------------------------------------------------

    private void look(Entity actor, String args) {
        Room room = currentRoom(actor);
        if (!args.isEmpty()) {
            Entity target = ctx.world().findInRoom(room.id(), args, actor.id())
                    .orElseThrow(() -> new CommandRejectedException("You don't see '" + args + "' here."));
            String condition = target.isAlive()
                    ? String.format(Locale.ROOT, "%.0f%% health", 100.0 * target.currentHealth() / target.maxHealth())
                    : "dead";
            reply(actor, target.name() + " (" + condition + ")"
                    + target.equipped().map(w -> ", wielding " + w.name()).orElse(""));
            return;
        }
        reply(actor, describe(room, actor.id()));
    }

    private void help(Entity actor, String args) {
        if (args.isEmpty()) {
            reply(actor, registry.help());
            return;
        }
        reply(actor, registry.help(args)
                .orElseThrow(() -> new CommandRejectedException("No help for '" + args + "'.")));
    }

    // ---------------------------------------------------------------------
    // Communication
    // ---------------------------------------------------------------------

    private void say(Entity actor, String args) {
        if (args.isEmpty()) {
            throw new CommandRejectedException("Say what?");
        }
        RoomId room = currentRoom(actor).id();
        reply(actor, "You say: " + args);
        ctx.dispatcher().publish(OutboundEvent.toRoom(room, EventKind.MESSAGE,
                actor.name() + " says: " + args, actor.id()));
    }

    // ---------------------------------------------------------------------
    // Movement
    // ---------------------------------------------------------------------

    private void go(Entity actor, String args) {
        Direction d = Direction.parse(args)
                .orElseThrow(() -> new CommandRejectedException("Go where?"));
        move(actor, d);
    }

    private void move(Entity actor, Direction direction) {
        requireAlive(actor, "You can't move while dead.");
        Room from = currentRoom(actor);
        RoomId to = from.exitTo(direction)
                .filter(id -> ctx.world().room(id).isPresent())
                .orElseThrow(() -> new CommandRejectedException("You can't go that way."));

        if (actor.combat().inCombat()) {
            combat.reset(actor);
            reply(actor, "You break off combat.");
        }
        ctx.world().move(actor, to);
        ctx.dirty().markDirty(actor.id());

        EventDispatcher out = ctx.dispatcher();
        out.publish(OutboundEvent.toRoom(from.id(), EventKind.MESSAGE,
                actor.name() + " leaves " + direction.label() + ".", actor.id()));
        out.publish(OutboundEvent.toRoom(to, EventKind.MESSAGE,
                actor.name() + " arrives.", actor.id()));
        reply(actor, describe(currentRoom(actor), actor.id()));
    }

    // ---------------------------------------------------------------------
    // Combat
    // ---------------------------------------------------------------------

    private void attack(Entity actor, String args) {
        if (args.isEmpty()) {
            throw new CommandRejectedException("Attack whom?");
        }
        Room room = currentRoom(actor);
        Entity target = ctx.world().findInRoom(room.id(), args, actor.id())
                .orElseThrow(() -> new CommandRejectedException("'" + args + "' not found."));
        combat.engageRefusal(actor, target).ifPresent(reason -> {
            throw new CommandRejectedException(reason);
        });
        combat.engage(actor, target);
    }

    private void stop(Entity actor, String args) {
        requireInCombat(actor);
        combat.disengage(actor);
    }

    private void flee(Entity actor, String args) {
        requireAlive(actor, "You can't flee while dead.");
        requireInCombat(actor);
        if (currentRoom(actor).exits().isEmpty()) {
            throw new CommandRejectedException("There's nowhere to flee!");
        }
        combat.flee(actor);
    }

    private void combatStatus(Entity actor, String args) {
        reply(actor, combat.status(actor));
    }

    private void respawn(Entity actor, String args) {
        if (actor.isAlive()) {
            throw new CommandRejectedException("You are not dead.");
        }
        combat.respawn(actor);
    }

    // ---------------------------------------------------------------------
    // Equipment
    // ---------------------------------------------------------------------

    private void wield(Entity actor, String args) {
        if (args.isEmpty()) {
            throw new CommandRejectedException("Wield what?");
        }
        requireAlive(actor, "You can't do that while dead.");
        WeaponStats weapon = actor.findCarried(args)
                .orElseThrow(() -> new CommandRejectedException("You don't have '" + args + "'."));
        actor.equip(weapon);
        ctx.dirty().markDirty(actor.id());
        reply(actor, String.format(Locale.ROOT, "You wield the %s. (%d-%d %s, %.1fs)",
                weapon.name(), weapon.damageMin(), weapon.damageMax(), weapon.damageType(),
                weapon.swingInterval().toMillis() / 1000.0));
    }

    private void unwield(Entity actor, String args) {
        WeaponStats weapon = actor.equipped()
                .orElseThrow(() -> new CommandRejectedException("You aren't wielding anything."));
        actor.unequip();
        ctx.dirty().markDirty(actor.id());
        reply(actor, "You stop wielding the " + weapon.name() + ".");
    }

    // ---------------------------------------------------------------------
    // Effects
    // ---------------------------------------------------------------------

    private void listEffects(Entity actor, String args) {
        reply(actor, effects.summary(actor));
    }

    private void applyEffect(Entity actor, String args, EffectSpec spec) {
        Entity target = actor;
        if (!args.isEmpty()) {
            Room room = currentRoom(actor);
            target = ctx.world().findInRoom(room.id(), args, actor.id())
                    .orElseThrow(() -> new CommandRejectedException("'" + args + "' not found."));
        }
        if (!target.isAlive()) {
            throw new CommandRejectedException(target.name() + " is dead.");
        }
        effects.apply(target.id(), spec);
        if (target != actor) {
            reply(actor, "You cast " + spec.name().toLowerCase(Locale.ROOT) + " on " + target.name() + ".");
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Room currentRoom(Entity actor) {
        return actor.room().flatMap(ctx.world()::room)
                .orElseThrow(() -> new CommandRejectedException("You are nowhere."));
    }

    private String describe(Room room, EntityId viewer) {
        List<String> lines = new ArrayList<>();
        lines.add(room.name());
        if (!room.description().isEmpty()) {
            lines.add(room.description());
        }
        lines.add("Exits: " + (room.exits().isEmpty()
                ? "none"
                : room.exits().keySet().stream().map(Direction::label).collect(Collectors.joining(", "))));
        List<String> present = new ArrayList<>();
        for (Entity e : ctx.world().occupants(room.id())) {
            if (!e.id().equals(viewer)) {
                present.add(e.isAlive() ? e.name() : "the corpse of " + e.name());
            }
        }
        if (!present.isEmpty()) {
            lines.add("Here: " + String.join(", ", present));
        }
        return String.join("\n", lines);
    }

    private void reply(Entity actor, String text) {
        ctx.dispatcher().publish(OutboundEvent.message(actor.id(), text));
    }

    private static void requireAlive(Entity actor, String message) {
        if (!actor.isAlive()) {
            throw new CommandRejectedException(message);
        }
    }

    private static void requireInCombat(Entity actor) {
        if (!actor.combat().inCombat()) {
            throw new CommandRejectedException("You're not in combat.");
        }
    }
}
