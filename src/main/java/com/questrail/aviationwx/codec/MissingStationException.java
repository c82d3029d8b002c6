package com.questrail.aviationwx.codec;

/**
 * No four-letter station identifier was found where the report grammar requires one.
 */
public final class MissingStationException extends ReportDecodeException
{
    public MissingStationException(String message) {
        super(message);
    }
}
