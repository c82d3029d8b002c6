package com.questrail.aviationwx.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ReportObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jReportObservabilitySink implements ReportObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReportObservabilitySink.class);

    @Override
    public void onReportDecoded(ReportDecodedEvent event) {
        if (event.isClean()) {
            log.debug("{} {} decoded ({} tokens)",
                event.kind(),
                event.station(),
                event.tokenCount());
        } else {
            log.info("{} {} decoded with {} field defect(s)",
                event.kind(),
                event.station(),
                event.defectCount());
        }
    }

    @Override
    public void onFieldDefect(FieldDefectEvent event) {
        log.warn("{} field defect: {}", event.kind(), event.defect());
    }

    @Override
    public void onError(ReportErrorEvent event) {
        log.error("{} decode failed: {} [raw: {}]", event.kind(), event.message(), event.rawText(), event.cause());
    }
}
