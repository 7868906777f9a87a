package com.airbrief.service.prefs;

import com.airbrief.core.model.AlertVariant;

import java.time.LocalTime;

/**
 * An enabled alert that should have exactly one live schedule.
 */
public record AlertPlan(AlertVariant variant, String displayName, LocalTime time) {
}
