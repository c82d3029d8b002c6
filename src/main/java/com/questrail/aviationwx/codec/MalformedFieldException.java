package com.questrail.aviationwx.codec;

import com.questrail.aviationwx.model.FieldDefect;

import java.util.Objects;

/**
 * A recognised field token does not match its expected shape or carries an out-of-range value.
 *
 * <p>Never escapes a decoder: it is caught per token and converted to a
 * {@link FieldDefect} on the record.</p>
 */
public final class MalformedFieldException extends ReportDecodeException
{
    private final String field;
    private final String token;
    private final String reason;

    public MalformedFieldException(String field, String token, String reason) {
        super(field + " '" + token + "': " + reason);
        this.field = Objects.requireNonNull(field, "field");
        this.token = Objects.requireNonNull(token, "token");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public MalformedFieldException(String field, String token, String reason, Throwable cause) {
        super(field + " '" + token + "': " + reason, cause);
        this.field = Objects.requireNonNull(field, "field");
        this.token = Objects.requireNonNull(token, "token");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String field() {
        return field;
    }

    public String token() {
        return token;
    }

    public String reason() {
        return reason;
    }

    /**
     * Converts this failure into the defect recorded on the report.
     */
    public FieldDefect toDefect() {
        return new FieldDefect(field, token, reason);
    }
}
