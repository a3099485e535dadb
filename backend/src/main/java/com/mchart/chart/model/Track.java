package com.mchart.chart.model;

import com.mchart.chart.error.ChartValidationException;

import java.util.List;

public record Track(
    String title,
    String artist,
    List<String> artists,
    String image,
    String album
) {
    public Track {
        if (title == null || title.isBlank()) {
            throw new ChartValidationException("Track title must not be empty");
        }
        if (artist == null || artist.isBlank()) {
            throw new ChartValidationException("Track artist must not be empty (title=" + title + ")");
        }
        artists = artists == null ? List.of() : List.copyOf(artists);
        image = image == null ? "" : image;
        album = album == null ? "" : album;
    }
}
