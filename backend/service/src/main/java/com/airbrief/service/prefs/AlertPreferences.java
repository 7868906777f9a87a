package com.airbrief.service.prefs;

import com.airbrief.core.model.AlertKind;
import com.airbrief.core.model.AlertVariant;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the user chose for one saved location. Only the report toggles and the custom
 * alerts drive scheduling; threshold, pollen and storm flags are stored for the host app.
 */
public record AlertPreferences(
        String locationId,
        ReportSetting morning,
        ReportSetting evening,
        List<CustomAlert> customAlerts,
        boolean aqiThresholdEnabled,
        int aqiThreshold,
        boolean pollenAlertEnabled,
        boolean stormAlertEnabled,
        Instant updatedAt
) {
    public static final LocalTime DEFAULT_MORNING_TIME = LocalTime.of(8, 0);
    public static final LocalTime DEFAULT_EVENING_TIME = LocalTime.of(18, 0);
    public static final int DEFAULT_AQI_THRESHOLD = 100;

    public AlertPreferences {
        Objects.requireNonNull(locationId, "locationId is required");
        if (morning == null) {
            morning = new ReportSetting(false, DEFAULT_MORNING_TIME, AlertKind.MORNING.defaultName());
        }
        if (evening == null) {
            evening = new ReportSetting(false, DEFAULT_EVENING_TIME, AlertKind.EVENING.defaultName());
        }
        customAlerts = customAlerts == null ? List.of() : List.copyOf(customAlerts);
    }

    public static AlertPreferences defaults(String locationId, Instant now) {
        return new AlertPreferences(locationId, null, null, List.of(), false, DEFAULT_AQI_THRESHOLD, false, false, now);
    }

    public List<AlertPlan> enabledPlans() {
        List<AlertPlan> plans = new ArrayList<>();
        if (morning.enabled()) {
            plans.add(new AlertPlan(AlertVariant.MORNING, nameOr(morning.name(), AlertKind.MORNING), morning.time()));
        }
        if (evening.enabled()) {
            plans.add(new AlertPlan(AlertVariant.EVENING, nameOr(evening.name(), AlertKind.EVENING), evening.time()));
        }
        for (CustomAlert alert : customAlerts) {
            if (alert.enabled()) {
                plans.add(new AlertPlan(alert.variant(), nameOr(alert.name(), AlertKind.CUSTOM), alert.time()));
            }
        }
        return plans;
    }

    public Optional<CustomAlert> customAlert(String alertId) {
        return customAlerts.stream().filter(alert -> alert.id().equals(alertId)).findFirst();
    }

    public AlertPreferences withCustomAlerts(List<CustomAlert> alerts, Instant now) {
        return new AlertPreferences(
                locationId,
                morning,
                evening,
                alerts,
                aqiThresholdEnabled,
                aqiThreshold,
                pollenAlertEnabled,
                stormAlertEnabled,
                now
        );
    }

    private static String nameOr(String name, AlertKind kind) {
        return name == null || name.isBlank() ? kind.defaultName() : name.trim();
    }
}
