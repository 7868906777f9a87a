package com.airbrief.content.summary;

import com.airbrief.core.model.EnvironmentalSnapshot;

import java.util.ArrayList;
import java.util.List;

final class SummaryPrompts {
    static final String SYSTEM_PROMPT = "You are an air quality expert who creates friendly, helpful summaries for "
            + "people checking local environmental conditions. Keep responses concise and encouraging.";

    private SummaryPrompts() {
    }

    static String userPrompt(EnvironmentalSnapshot snapshot, int maxDescriptionChars) {
        return """
                Generate a friendly, personalized air quality summary for %s.

                Current conditions:
                %s

                Please provide:
                1. A fun headline (2-4 words) describing the air quality, pollen, storm risk or overall conditions.
                2. A brief description (under %d characters) that is encouraging, actionable and informative for people with allergies or asthma.

                Focus on how safe it is to go outside, any precautions needed, and the overall air quality.

                Response format:
                Headline: [Your headline]
                Description: [Your description]

                Do not include any unnecessary quotes."""
                .formatted(snapshot.locationName(), String.join("\n", conditions(snapshot)), maxDescriptionChars);
    }

    static List<String> conditions(EnvironmentalSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        if (snapshot.hasAqi()) {
            lines.add("Air Quality Index: " + snapshot.aqi() + " (" + snapshot.aqiCategory() + ")");
        } else {
            lines.add("Air Quality Index: currently unavailable");
        }
        if (snapshot.hasPollen()) {
            lines.add("Pollen level: " + snapshot.pollenIndex());
        }
        if (snapshot.hasStormProbability()) {
            lines.add("Storm probability: " + snapshot.stormProbability() + "%");
        }
        return lines;
    }
}
