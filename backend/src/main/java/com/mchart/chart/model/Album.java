package com.mchart.chart.model;

import com.mchart.chart.error.ChartValidationException;

import java.util.List;

/**
 * A multi-track release ranked on a collection chart.
 */
public record Album(
    String title,
    String artist,
    List<String> artists,
    String image
) {
    public Album {
        if (title == null || title.isBlank()) {
            throw new ChartValidationException("Album title must not be empty");
        }
        if (artist == null || artist.isBlank()) {
            throw new ChartValidationException("Album artist must not be empty (title=" + title + ")");
        }
        artists = artists == null ? List.of() : List.copyOf(artists);
        image = image == null ? "" : image;
    }
}
