package com.mchart.chart.extract;

import com.mchart.chart.ChartPageFixtures;
import com.mchart.chart.catalog.ChartCatalog;
import com.mchart.chart.model.ChartPageResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ChartPageParserTest {
    private static final String URL = "https://www.billboard.com/charts/hot-100/";

    private final ChartPageParser parser =
        new ChartPageParser(Clock.fixed(Instant.parse("2026-03-04T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void parsesRowsDateAndDescription() {
        ChartPageResult page = parser.parse(
            ChartPageFixtures.HOT_100_PAGE,
            URL,
            ChartCatalog.require("hot-100"),
            true,
            null
        );

        assertEquals("hot-100", page.chartId());
        assertEquals(URL, page.url());
        assertEquals(LocalDate.of(2026, 1, 21), page.publishedDate());
        assertEquals("The week's most popular songs", page.description());
        assertThat(page.records()).hasSize(2);
    }

    @Test
    void descriptionFallsBackToChartTableText() {
        ChartPageResult hot100 = parser.parse(ChartPageFixtures.EMPTY_PAGE, URL, ChartCatalog.require("hot-100"), true, null);
        ChartPageResult radio = parser.parse(ChartPageFixtures.EMPTY_PAGE, URL, ChartCatalog.require("radio-songs"), true, null);

        assertThat(hot100.description()).contains("most popular songs");
        assertEquals("The radio-songs chart on Billboard", radio.description());
        assertThat(hot100.hasRecords()).isFalse();
        assertEquals(LocalDate.of(2026, 3, 4), hot100.publishedDate());
    }
}
