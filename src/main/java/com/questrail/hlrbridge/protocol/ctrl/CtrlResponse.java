package com.questrail.hlrbridge.protocol.ctrl;

import java.util.Objects;

/**
 * One CTRL response as sent by the peer.
 *
 * <p>Wire text: {@code <type> <id> <rest>}. For type {@code ERROR} the rest is
 * the error text; otherwise it is {@code <variable>[ <value>]}.</p>
 *
 * @param variable {@code null} for errors
 * @param value    {@code null} for errors and for replies without a value
 * @param error    {@code null} unless {@link #isError()}
 */
public record CtrlResponse(String type, int id, String variable, String value, String error) {

    public static final String ERROR = "ERROR";

    public CtrlResponse {
        Objects.requireNonNull(type, "type");
    }

    public boolean isError() {
        return ERROR.equals(type);
    }

    /**
     * @throws IllegalArgumentException if {@code text} does not have at least
     *                                  three whitespace-separated parts or the
     *                                  id is not a number
     */
    public static CtrlResponse parse(String text) {
        Objects.requireNonNull(text, "text");
        String[] parts = text.strip().split("\\s+", 3);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Malformed CTRL response: '" + text + "'");
        }

        final int id;
        try {
            id = Integer.parseInt(parts[1]);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed CTRL message id: '" + parts[1] + "'", e);
        }

        if (ERROR.equals(parts[0])) {
            return new CtrlResponse(parts[0], id, null, null, parts[2]);
        }

        String[] rest = parts[2].split("\\s+", 2);
        return new CtrlResponse(parts[0], id, rest[0], rest.length > 1 ? rest[1] : null, null);
    }
}
