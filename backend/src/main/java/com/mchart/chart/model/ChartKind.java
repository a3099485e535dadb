package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChartKind {
    SINGLE("single"),
    COLLECTION("collection");

    private final String tag;

    ChartKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public EntryKind entryKind() {
        return this == COLLECTION ? EntryKind.COLLECTION : EntryKind.TRACK;
    }

    @JsonCreator
    public static ChartKind fromTag(String tag) {
        String normalized = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (ChartKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown chart kind: " + tag);
    }
}
