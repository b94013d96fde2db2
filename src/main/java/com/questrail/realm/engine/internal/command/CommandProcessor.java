package com.questrail.realm.engine.internal.command;

import com.questrail.realm.engine.internal.combat.CombatSystem;
import com.questrail.realm.engine.internal.dispatch.EventDispatcher;
import com.questrail.realm.engine.internal.dispatch.EventKind;
import com.questrail.realm.engine.internal.dispatch.OutboundEvent;
import com.questrail.realm.engine.internal.exec.EngineContext;
import com.questrail.realm.engine.internal.world.Entity;
import com.questrail.realm.engine.observability.CommandRejectedEvent;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandProcessor
 * =============================================================================
 * Executes one {@link Command} as one unit of work.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>Connect for an id that is unknown or names an NPC: refused, reported
 *       to the transport through the delivery listener</li>
 *   <li>Any other command whose source is not a known participant: silent
 *       no-op</li>
 *   <li>Unknown verb or handler refusal: a single ERROR event to the source,
 *       nothing mutated</li>
 *   <li>Anything else thrown propagates to the engine loop, which treats it as
 *       a fault</li>
 * </ul>
 */
public final class CommandProcessor
{
    private final EngineContext ctx;
    private final CommandRegistry registry;
    private final CombatSystem combat;

    public CommandProcessor(EngineContext ctx, CommandRegistry registry, CombatSystem combat) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.combat = Objects.requireNonNull(combat, "combat");
    }

    public void process(Command command) {
        Optional<Entity> actor = ctx.world().entity(command.sourceId())
                .filter(Entity::isParticipant);
        if (actor.isEmpty()) {
            if (command.kind() == Command.Kind.CONNECT) {
                refuseConnect(command);
            }
            return;
        }
        switch (command.kind()) {
            case CONNECT:
                connect(actor.get());
                break;
            case DISCONNECT:
                disconnect(actor.get());
                break;
            case INPUT:
                input(actor.get(), command);
                break;
            default:
                throw new IllegalStateException("unknown command kind: " + command.kind());
        }
    }

    private void input(Entity actor, Command command) {
        String line = command.text().trim();
        if (line.isEmpty()) {
            return;
        }
        int space = line.indexOf(' ');
        String verb = (space < 0 ? line : line.substring(0, space)).toLowerCase(Locale.ROOT);
        String args = space < 0 ? "" : line.substring(space + 1).trim();

        try {
            CommandRegistry.Registration registration = registry.resolve(verb)
                    .orElseThrow(() -> new CommandRejectedException(
                            "Unknown command '" + verb + "'. Type 'help' for a list of commands."));
            registration.handler().handle(actor, args);
        } catch (CommandRejectedException e) {
            ctx.dispatcher().publish(OutboundEvent.error(actor.id(), e.getMessage()));
            ctx.sink().onCommandRejected(new CommandRejectedEvent(
                    ctx.wallNow(), actor.id(), command.text(), e.getMessage()));
        }
    }

    private void refuseConnect(Command command) {
        String reason = "There is no character named '" + command.sourceId() + "'.";
        ctx.dispatcher().refuseConnect(command.sourceId(), reason);
        ctx.sink().onCommandRejected(new CommandRejectedEvent(
                ctx.wallNow(), command.sourceId(), "connect", reason));
    }

    private void connect(Entity actor) {
        EventDispatcher out = ctx.dispatcher();
        out.register(actor.id());
        actor.setConnected(true);
        ctx.dirty().markDirty(actor.id());

        out.publish(OutboundEvent.message(actor.id(), "Welcome, " + actor.name() + "."));
        out.publish(OutboundEvent.statUpdate(actor));
        actor.room().ifPresent(r -> out.publish(OutboundEvent.toRoom(r, EventKind.MESSAGE,
                actor.name() + " has entered the realm.", actor.id())));
    }

    private void disconnect(Entity actor) {
        combat.reset(actor);
        for (Entity other : ctx.world().entities()) {
            if (other.combat().target().filter(actor.id()::equals).isPresent()) {
                combat.reset(other);
                ctx.dispatcher().publish(OutboundEvent.toParticipant(other.id(), EventKind.COMBAT,
                        actor.name() + " fades from view. Combat ended."));
            }
        }
        actor.setConnected(false);
        ctx.dirty().markDirty(actor.id());
        actor.room().ifPresent(r -> ctx.dispatcher().publish(OutboundEvent.toRoom(r, EventKind.MESSAGE,
                actor.name() + " has left the realm.", actor.id())));
        ctx.dispatcher().unregister(actor.id());
    }
}
