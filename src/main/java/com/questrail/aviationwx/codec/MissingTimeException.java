package com.questrail.aviationwx.codec;

/**
 * A mandatory time group (observation time, issue time or validity period) is absent.
 */
public final class MissingTimeException extends ReportDecodeException
{
    public MissingTimeException(String message) {
        super(message);
    }
}
