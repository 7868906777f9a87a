package com.airbrief.service.prefs;

import com.airbrief.core.util.TimeOfDay;

import java.time.Instant;

/**
 * Partial update of {@link AlertPreferences}. Null fields leave the stored value alone;
 * times are strict {@code HH:MM} strings.
 */
public record AlertPreferencesPatch(
        Boolean morningEnabled,
        String morningTime,
        String morningName,
        Boolean eveningEnabled,
        String eveningTime,
        String eveningName,
        Boolean aqiThresholdEnabled,
        Integer aqiThreshold,
        Boolean pollenAlertEnabled,
        Boolean stormAlertEnabled
) {
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException for a malformed time or a negative threshold
     */
    public AlertPreferences applyTo(AlertPreferences base, Instant now) {
        ReportSetting morning = base.morning();
        if (morningEnabled != null) {
            morning = morning.withEnabled(morningEnabled);
        }
        if (morningTime != null) {
            morning = morning.withTime(TimeOfDay.parseOrThrow(morningTime));
        }
        if (morningName != null) {
            morning = morning.withName(morningName);
        }
        ReportSetting evening = base.evening();
        if (eveningEnabled != null) {
            evening = evening.withEnabled(eveningEnabled);
        }
        if (eveningTime != null) {
            evening = evening.withTime(TimeOfDay.parseOrThrow(eveningTime));
        }
        if (eveningName != null) {
            evening = evening.withName(eveningName);
        }
        if (aqiThreshold != null && aqiThreshold < 0) {
            throw new IllegalArgumentException("aqiThreshold must be >= 0");
        }
        return new AlertPreferences(
                base.locationId(),
                morning,
                evening,
                base.customAlerts(),
                aqiThresholdEnabled == null ? base.aqiThresholdEnabled() : aqiThresholdEnabled,
                aqiThreshold == null ? base.aqiThreshold() : aqiThreshold,
                pollenAlertEnabled == null ? base.pollenAlertEnabled() : pollenAlertEnabled,
                stormAlertEnabled == null ? base.stormAlertEnabled() : stormAlertEnabled,
                now
        );
    }

    public static final class Builder {
        private Boolean morningEnabled;
        private String morningTime;
        private String morningName;
        private Boolean eveningEnabled;
        private String eveningTime;
        private String eveningName;
        private Boolean aqiThresholdEnabled;
        private Integer aqiThreshold;
        private Boolean pollenAlertEnabled;
        private Boolean stormAlertEnabled;

        private Builder() {
        }

        public Builder morningEnabled(boolean value) {
            this.morningEnabled = value;
            return this;
        }

        public Builder morningTime(String value) {
            this.morningTime = value;
            return this;
        }

        public Builder morningName(String value) {
            this.morningName = value;
            return this;
        }

        public Builder eveningEnabled(boolean value) {
            this.eveningEnabled = value;
            return this;
        }

        public Builder eveningTime(String value) {
            this.eveningTime = value;
            return this;
        }

        public Builder eveningName(String value) {
            this.eveningName = value;
            return this;
        }

        public Builder aqiThresholdEnabled(boolean value) {
            this.aqiThresholdEnabled = value;
            return this;
        }

        public Builder aqiThreshold(int value) {
            this.aqiThreshold = value;
            return this;
        }

        public Builder pollenAlertEnabled(boolean value) {
            this.pollenAlertEnabled = value;
            return this;
        }

        public Builder stormAlertEnabled(boolean value) {
            this.stormAlertEnabled = value;
            return this;
        }

        public AlertPreferencesPatch build() {
            return new AlertPreferencesPatch(
                    morningEnabled,
                    morningTime,
                    morningName,
                    eveningEnabled,
                    eveningTime,
                    eveningName,
                    aqiThresholdEnabled,
                    aqiThreshold,
                    pollenAlertEnabled,
                    stormAlertEnabled
            );
        }
    }
}
