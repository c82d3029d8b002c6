package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.MalformedFieldException;
import com.questrail.aviationwx.model.FieldDefect;
import com.questrail.aviationwx.observability.FieldDefectEvent;
import com.questrail.aviationwx.observability.ReportKind;
import com.questrail.aviationwx.observability.ReportObservabilitySink;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-decode collector of field defects. Each defect is forwarded to the
 * observability sink as it is recorded.
 */
final class DefectLog
{
    private final ReportKind kind;
    private final ReportObservabilitySink sink;
    private final Clock clock;
    private final List<FieldDefect> defects = new ArrayList<>();

    DefectLog(ReportKind kind, ReportObservabilitySink sink, Clock clock) {
        this.kind = kind;
        this.sink = sink;
        this.clock = clock;
    }

    void record(FieldDefect defect) {
        defects.add(defect);
        sink.onFieldDefect(new FieldDefectEvent(clock.instant(), kind, defect));
    }

    void record(String field, String token, String reason) {
        record(new FieldDefect(field, token, reason));
    }

    void record(MalformedFieldException e) {
        record(e.toDefect());
    }

    List<FieldDefect> defects() {
        return List.copyOf(defects);
    }

    int size() {
        return defects.size();
    }
}
