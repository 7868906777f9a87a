package com.airbrief.content.generator;

public record GeneratedAlert(String message, boolean fallback) {
}
