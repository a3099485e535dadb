package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Unvalidated field values pulled out of one chart row. Plain data so it can leave the crawl worker.
 */
public record RawChartRecord(
    @JsonProperty("rank") int rank,
    @JsonProperty("title") String title,
    @JsonProperty("artist") String artist,
    @JsonProperty("artists") List<String> artists,
    @JsonProperty("image") String image,
    @JsonProperty("weeks_on_chart") int weeksOnChart,
    @JsonProperty("last_week") int lastWeek,
    @JsonProperty("peak_position") int peakPosition,
    @JsonProperty("peak_position_inferred") boolean peakPositionInferred,
    @JsonProperty("entry_kind") EntryKind entryKind
) {
    public RawChartRecord {
        artists = artists == null ? List.of() : List.copyOf(artists);
        image = image == null ? "" : image;
    }
}
