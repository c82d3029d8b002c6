package com.questrail.aviationwx.codec;

/**
 * The raw report is null, empty or whitespace only.
 */
public final class EmptyReportException extends ReportDecodeException
{
    public EmptyReportException(String message) {
        super(message);
    }
}
