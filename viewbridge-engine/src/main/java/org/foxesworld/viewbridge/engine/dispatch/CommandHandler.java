package org.foxesworld.viewbridge.engine.dispatch;

/**
 * Executes commands on the owner thread. Returns the result code published to the submitter.
 */
@FunctionalInterface
public interface CommandHandler {

    int handle(Command command);
}
