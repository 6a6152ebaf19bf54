package com.elime.service;

/**
 * What a command got done before it finished or the operator quit.
 *
 * @param processed photos stored, deleted or frames written
 */
public record CommandOutcome(int processed, boolean cancelled) {

    public static CommandOutcome done(int processed) {
        return new CommandOutcome(processed, false);
    }

    public static CommandOutcome cancelled(int processed) {
        return new CommandOutcome(processed, true);
    }
}
