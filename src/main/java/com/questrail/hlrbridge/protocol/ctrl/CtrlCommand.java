package com.questrail.hlrbridge.protocol.ctrl;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One CTRL request.
 *
 * <p>Wire text: {@code GET <id> <variable>} or
 * {@code SET <id> <variable> <value>}.</p>
 *
 * @param value {@code null} for GET
 */
public record CtrlCommand(Action action, int id, String variable, String value) {

    public static final int MIN_ID = 10000;
    public static final int MAX_ID = 20000;

    public enum Action {
        GET,
        SET
    }

    public CtrlCommand {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(variable, "variable");
        if (variable.isBlank() || variable.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid CTRL variable: '" + variable + "'");
        }
        if (action == Action.SET) {
            Objects.requireNonNull(value, "value");
        }
        else if (value != null) {
            throw new IllegalArgumentException("GET carries no value");
        }
    }

    public static CtrlCommand get(String variable) {
        return new CtrlCommand(Action.GET, nextId(), variable, null);
    }

    public static CtrlCommand set(String variable, String value) {
        return new CtrlCommand(Action.SET, nextId(), variable, value);
    }

    public String toWireText() {
        return action == Action.SET
                ? action + " " + id + " " + variable + " " + value
                : action + " " + id + " " + variable;
    }

    private static int nextId() {
        return ThreadLocalRandom.current().nextInt(MIN_ID, MAX_ID + 1);
    }
}
