package com.questrail.aviationwx.observability;

/**
 * Report family an event refers to.
 */
public enum ReportKind {
    METAR,
    TAF
}
