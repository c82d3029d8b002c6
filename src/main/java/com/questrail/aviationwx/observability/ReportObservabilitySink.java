package com.questrail.aviationwx.observability;

/**
 * Receives decode observability events.
 * Implementations can provide logging, metrics, or tracing, and must be thread-safe.
 */
public interface ReportObservabilitySink {
    /**
     * Called when a report has been decoded into a record.
     * @param event the decode summary
     */
    void onReportDecoded(ReportDecodedEvent event);

    /**
     * Called for every non-fatal field defect recorded on a report.
     * @param event the defect details
     */
    void onFieldDefect(FieldDefectEvent event);

    /**
     * Called when a report cannot be decoded at all.
     * @param event the error event
     */
    void onError(ReportErrorEvent event);
}
