package com.questrail.aviationwx.codec;

/**
 * Indicates that a raw report could not be decoded into a record.
 *
 * <p>Subclasses name the specific failure:</p>
 * <ul>
 *   <li>{@link EmptyReportException}: nothing to decode</li>
 *   <li>{@link MissingStationException}: no station identifier where one is required</li>
 *   <li>{@link MissingTimeException}: no time group where one is required</li>
 *   <li>{@link MalformedTimeException}: a time group has the wrong digit count or an out-of-range component</li>
 *   <li>{@link MalformedFieldException}: a field token does not match its expected shape</li>
 * </ul>
 *
 * <p>Only the identity fields (station, primary time, TAF validity) escalate to a
 * thrown exception from a decoder. Field-level problems are recorded on the
 * record as defects and decoding continues.</p>
 */
public class ReportDecodeException extends RuntimeException
{
    public ReportDecodeException(String message) {
        super(message);
    }

    public ReportDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
