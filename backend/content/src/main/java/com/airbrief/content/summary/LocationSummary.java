package com.airbrief.content.summary;

import java.util.Objects;

/**
 * Short headline plus a one-sentence description of current conditions, shown on the
 * location card.
 */
public record LocationSummary(String headline, String description) {
    public static final String DEFAULT_HEADLINE = "Air Quality Update";
    public static final String DEFAULT_DESCRIPTION = "Check current conditions for your area.";
    public static final LocationSummary FALLBACK =
            new LocationSummary(DEFAULT_HEADLINE, "Current environmental conditions for your area.");

    public LocationSummary {
        Objects.requireNonNull(headline, "headline is required");
        Objects.requireNonNull(description, "description is required");
    }
}
