package com.airbrief.core.model;

import java.util.Locale;

public enum AlertKind {
    MORNING("Morning Report", "🌅"),
    EVENING("Evening Report", "🌙"),
    CUSTOM("Air Quality Update", "🌤️");

    private final String defaultName;
    private final String icon;

    AlertKind(String defaultName, String icon) {
        this.defaultName = defaultName;
        this.icon = icon;
    }

    public String defaultName() {
        return defaultName;
    }

    public String icon() {
        return icon;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
