package com.airbrief.service.prefs;

import com.airbrief.core.util.TimeOfDay;

/**
 * Null fields leave the stored value alone.
 */
public record CustomAlertPatch(String name, String time, Boolean enabled) {
    public CustomAlert applyTo(CustomAlert base) {
        return new CustomAlert(
                base.id(),
                name == null ? base.name() : name,
                time == null ? base.time() : TimeOfDay.parseOrThrow(time),
                enabled == null ? base.enabled() : enabled
        );
    }
}
