package com.questrail.aviationwx.observability;

/**
 * No-op implementation of ReportObservabilitySink.
 */
public final class NullObservabilitySink implements ReportObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onReportDecoded(ReportDecodedEvent event) {}

    @Override
    public void onFieldDefect(FieldDefectEvent event) {}

    @Override
    public void onError(ReportErrorEvent event) {}
}
