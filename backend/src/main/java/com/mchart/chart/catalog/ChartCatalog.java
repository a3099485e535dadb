package com.mchart.chart.catalog;

import com.mchart.chart.model.ChartKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ChartCatalog {
    public static final String DEFAULT_CHART_ID = "hot-100";

    private static final Map<String, ChartDefinition> CHARTS = new LinkedHashMap<>();
    private static final Map<String, String> ALIASES = Map.of(
        "hot 100", "hot-100",
        "billboard hot 100", "hot-100",
        "200", "billboard-200",
        "billboard 200", "billboard-200",
        "global", "global-200",
        "artist", "artist-100"
    );

    static {
        register(
            "hot-100",
            "Billboard Hot 100",
            ChartKind.SINGLE,
            "The week's most popular songs across all genres",
            "The week's most popular songs across all genres, ranked by radio airplay, sales data, and streaming activity."
        );
        register(
            "billboard-200",
            "Billboard 200",
            ChartKind.COLLECTION,
            "The week's most popular albums across all genres",
            "The week's most popular albums across all genres, ranked by album sales and audio streaming."
        );
        register(
            "global-200",
            "Global 200",
            ChartKind.SINGLE,
            "The week's most popular songs globally",
            "The week's most popular songs globally, ranked by streaming and sales activity."
        );
        register("artist-100", "Artist 100", ChartKind.SINGLE, "The week's most popular artists", null);
        register("streaming-songs", "Streaming Songs", ChartKind.SINGLE, "The most-streamed songs of the week", null);
        register("radio-songs", "Radio Songs", ChartKind.SINGLE, "The most-played songs on radio", null);
        register("digital-song-sales", "Digital Song Sales", ChartKind.SINGLE, "The best-selling digital songs", null);
    }

    private ChartCatalog() {}

    private static void register(
        String id,
        String title,
        ChartKind kind,
        String listingDescription,
        String fallbackDescription
    ) {
        CHARTS.put(id, new ChartDefinition(id, "/charts/" + id, title, kind, listingDescription, fallbackDescription));
    }

    public static Optional<ChartDefinition> find(String canonicalId) {
        return Optional.ofNullable(CHARTS.get(canonicalId));
    }

    public static ChartDefinition require(String canonicalId) {
        ChartDefinition definition = CHARTS.get(canonicalId);
        if (definition == null) {
            throw new IllegalArgumentException("Not a canonical chart id: " + canonicalId);
        }
        return definition;
    }

    public static Optional<String> alias(String normalizedName) {
        return Optional.ofNullable(ALIASES.get(normalizedName));
    }

    public static List<String> identifiers() {
        return List.copyOf(CHARTS.keySet());
    }

    public static List<ChartDefinition> definitions() {
        return List.copyOf(CHARTS.values());
    }
}
