package com.questrail.aviationwx.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One TAF change group (FM, BECMG, TEMPO or PROB TEMPO) with its own window and conditions.
 *
 * <p>The {@code window} is the group's own parsed period. It is empty only when
 * the introducer was not followed by a usable period token; the decoder records
 * a field defect in that case.</p>
 *
 * @param kind               group kind
 * @param probabilityPercent 30 or 40 for {@link ChangeKind#PROBABLE_TEMPORARY}, empty otherwise
 * @param window             the group's own time window
 * @param conditions         fields changed by this group
 */
public record ForecastChangeGroup(
        ChangeKind kind,
        OptionalInt probabilityPercent,
        Optional<ChangeWindow> window,
        ForecastConditions conditions
) {
    public ForecastChangeGroup {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(probabilityPercent, "probabilityPercent");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(conditions, "conditions");

        if (kind == ChangeKind.PROBABLE_TEMPORARY) {
            int pct = probabilityPercent.orElse(-1);
            if (pct != 30 && pct != 40) {
                throw new IllegalArgumentException("PROB TEMPO probability must be 30 or 40 (was "
                        + (probabilityPercent.isPresent() ? pct : "absent") + ")");
            }
        } else if (probabilityPercent.isPresent()) {
            throw new IllegalArgumentException("Only PROB TEMPO groups carry a probability");
        }

        window.ifPresent(w -> {
            if (kind == ChangeKind.FROM && !(w instanceof StartInstant)) {
                throw new IllegalArgumentException("FM groups carry a start instant only");
            }
            if (kind != ChangeKind.FROM && !(w instanceof ValidityPeriod)) {
                throw new IllegalArgumentException(kind + " groups carry a DDHH/DDHH period");
            }
        });
    }

    /**
     * Display label, e.g. {@code BECOMING} or {@code PROB30 TEMPORARY}.
     */
    public String label() {
        if (kind == ChangeKind.PROBABLE_TEMPORARY) {
            return "PROB" + probabilityPercent.getAsInt() + " " + kind.label();
        }
        return kind.label();
    }
}
