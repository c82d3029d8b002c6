package com.questrail.aviationwx.codec;

/**
 * A time group has the wrong number of digits or a component out of range.
 */
public final class MalformedTimeException extends ReportDecodeException
{
    public MalformedTimeException(String message) {
        super(message);
    }

    public MalformedTimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
