package com.airbrief.service.prefs;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Morning or evening report toggle. A blank name means the kind's default name.
 */
public record ReportSetting(boolean enabled, LocalTime time, String name) {
    public ReportSetting {
        Objects.requireNonNull(time, "time is required");
    }

    public ReportSetting withEnabled(boolean value) {
        return new ReportSetting(value, time, name);
    }

    public ReportSetting withTime(LocalTime value) {
        return new ReportSetting(enabled, value, name);
    }

    public ReportSetting withName(String value) {
        return new ReportSetting(enabled, time, value);
    }
}
