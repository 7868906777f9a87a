package com.airbrief.content.generator;

import com.airbrief.core.model.AlertKind;
import com.airbrief.core.model.EnvironmentalSnapshot;

import java.util.ArrayList;
import java.util.List;

final class AlertPrompts {
    private AlertPrompts() {
    }

    static String systemPrompt(int maxChars) {
        return "You are an air quality expert creating brief, helpful push notification alerts. "
                + "Keep responses under " + maxChars + " characters and focus on actionable advice.";
    }

    static String userPrompt(EnvironmentalSnapshot snapshot, AlertKind kind, String alertName, int maxChars) {
        Focus focus = Focus.of(kind);
        return """
                Generate a concise air quality alert titled "%s" for %s for someone %s.

                Current conditions:
                %s

                Requirements:
                - Maximum %d characters (for push notification)
                - Focus on %s
                - Be actionable and helpful
                - Use a friendly, encouraging tone
                - Match the tone of the alert name "%s"

                %s

                Respond with just the alert message, no extra formatting.
                Do not include quotes around the message."""
                .formatted(
                        alertName,
                        snapshot.locationName(),
                        focus.timeContext(),
                        String.join("\n", conditions(snapshot)),
                        maxChars,
                        focus.area(),
                        alertName,
                        focus.details()
                );
    }

    /**
     * Lists only the readings the provider actually supplied.
     */
    static List<String> conditions(EnvironmentalSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        if (snapshot.hasAqi()) {
            lines.add("Air Quality: " + snapshot.aqi() + " (" + snapshot.aqiCategory() + ")");
        } else {
            lines.add("Air Quality: currently unavailable");
        }
        if (snapshot.hasPollen()) {
            lines.add("Pollen index: " + snapshot.pollenIndex());
        }
        if (snapshot.hasStormProbability()) {
            lines.add("Storm risk: " + snapshot.stormProbability() + "%");
        }
        return lines;
    }

    private record Focus(String timeContext, String area, String details) {
        static Focus of(AlertKind kind) {
            return switch (kind) {
                case MORNING -> new Focus(
                        "starting their day",
                        "outdoor planning and activities ahead",
                        "Focus: Help plan outdoor activities, commute, exercise");
                case EVENING -> new Focus(
                        "wrapping up their day",
                        "reflection on today and preparation for tomorrow",
                        "Focus: Summarize the day, suggest tomorrow preparation");
                case CUSTOM -> new Focus(
                        "checking in",
                        "current conditions and actionable advice",
                        "Focus: Provide helpful insights based on current air quality, pollen, and weather conditions");
            };
        }
    }
}
