package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntryKind {
    TRACK("track"),
    COLLECTION("collection");

    private final String tag;

    EntryKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static EntryKind fromTag(String tag) {
        String normalized = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (EntryKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entry kind: " + tag);
    }
}
