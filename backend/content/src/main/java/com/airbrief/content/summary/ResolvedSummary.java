package com.airbrief.content.summary;

import com.airbrief.content.generator.ResolvedAlert;

public record ResolvedSummary(LocationSummary summary, ResolvedAlert.Origin origin) {
}
