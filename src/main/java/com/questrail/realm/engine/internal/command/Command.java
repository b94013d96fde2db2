package com.questrail.realm.engine.internal.command;

import com.questrail.realm.api.EntityId;

import java.util.Objects;

/**
 * One queued unit of participant input.
 *
 * @param sequence        monotonically increasing, assigned at enqueue
 * @param sourceId        issuing participant
 * @param kind            input line or connection notice
 * @param text            raw instruction; empty for connection notices
 * @param enqueuedAtNanos monotonic enqueue time
 */
public record Command(long sequence,
                      EntityId sourceId,
                      Kind kind,
                      String text,
                      long enqueuedAtNanos)
{
    public enum Kind
    {
        INPUT,
        CONNECT,
        DISCONNECT
    }

    public Command {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        text = Objects.requireNonNullElse(text, "");
    }

    @Override
    public String toString() {
        return "Command#" + sequence + "{" + kind + " from " + sourceId
                + (kind == Kind.INPUT ? ": '" + text + "'" : "") + '}';
    }
}
