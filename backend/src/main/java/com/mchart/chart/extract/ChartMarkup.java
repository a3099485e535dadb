package com.mchart.chart.extract;

import java.util.List;

/**
 * CSS selectors and markers describing where a chart page keeps its row fields.
 */
public record ChartMarkup(
    String rowSelector,
    String labelSelector,
    String titleSelector,
    String artistHrefMarker,
    List<String> imageAttributes,
    String imagePlaceholderMarker
) {
    public ChartMarkup {
        imageAttributes = List.copyOf(imageAttributes);
    }

    public static ChartMarkup billboard() {
        return new ChartMarkup(
            "ul.o-chart-results-list-row",
            "span.c-label",
            "h3.c-title",
            "/artist/",
            List.of("data-lazy-src", "data-src", "data-original", "src"),
            "lazyload-fallback"
        );
    }
}
