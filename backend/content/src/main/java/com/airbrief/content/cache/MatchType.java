package com.airbrief.content.cache;

public enum MatchType {
    EXACT,
    FUZZY
}
