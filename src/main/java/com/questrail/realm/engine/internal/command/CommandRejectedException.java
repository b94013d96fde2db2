package com.questrail.realm.engine.internal.command;

/**
 * Thrown by a {@link CommandHandler} that refuses a command before changing
 * anything. The message is shown to the issuing participant.
 */
public final class CommandRejectedException extends RuntimeException
{
    public CommandRejectedException(String message) {
        super(message);
    }
}
