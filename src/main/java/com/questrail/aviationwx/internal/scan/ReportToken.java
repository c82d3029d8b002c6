package com.questrail.aviationwx.internal.scan;

import java.util.Objects;

/**
 * One whitespace-delimited report group.
 *
 * @param position zero-based position in the report
 * @param text     the group exactly as it appeared in the raw text
 * @param shape    primary lexical shape
 */
public record ReportToken(int position, String text, TokenShape shape)
{
    public ReportToken {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(shape, "shape");
    }

    public static ReportToken of(int position, String text) {
        return new ReportToken(position, text, TokenShape.classify(text));
    }

    public boolean is(TokenShape expected) {
        return shape == expected;
    }

    /**
     * Tests the token text against {@code candidate} regardless of its primary shape.
     */
    public boolean matches(TokenShape candidate) {
        return candidate.matches(text);
    }

    @Override
    public String toString() {
        return text + "<" + shape + "@" + position + ">";
    }
}
