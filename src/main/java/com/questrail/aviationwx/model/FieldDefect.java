package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * A non-fatal decode problem recorded on a report.
 *
 * @param field  the field the token was taken for, e.g. {@code wind}, or {@code unrecognized}
 * @param token  the offending token text
 * @param reason human-readable description
 */
public record FieldDefect(String field, String token, String reason)
{
    public FieldDefect {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String toString() {
        return field + " '" + token + "': " + reason;
    }
}
