package com.airbrief.content.generator;

import com.airbrief.core.model.AlertKind;

/**
 * Static bodies used whenever generation is unavailable. Each fits the push-notification limit.
 */
public final class FallbackMessages {
    public static final String MORNING =
            "Morning air quality check: Review conditions before outdoor activities. Have a great day! ☀️";
    public static final String EVENING =
            "Evening air quality summary: Today's conditions logged. Rest well and plan for tomorrow! 🌙";
    public static final String CUSTOM =
            "Air quality check: Current conditions available. Review and plan your activities! 🌤️";

    public static final String TEST_MORNING =
            "Good morning! This is a test of your morning air quality report. ☀️";
    public static final String TEST_EVENING =
            "Good evening! This is a test of your evening air quality summary. 🌙";

    private FallbackMessages() {
    }

    public static String forKind(AlertKind kind) {
        return switch (kind) {
            case MORNING -> MORNING;
            case EVENING -> EVENING;
            case CUSTOM -> CUSTOM;
        };
    }

    public static String testFor(AlertKind kind) {
        return kind == AlertKind.EVENING ? TEST_EVENING : TEST_MORNING;
    }
}
