package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mchart.chart.error.ChartValidationException;

import java.util.List;

/**
 * One ranked position. Holds exactly one of {@link Track} or {@link Album}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChartEntry(
    @JsonProperty("track") Track track,
    @JsonProperty("collection") Album album,
    @JsonProperty("rank") int rank,
    @JsonProperty("weeks_on_chart") int weeksOnChart,
    @JsonProperty("last_week") int lastWeek,
    @JsonProperty("peak_position") int peakPosition,
    @JsonProperty("peak_position_inferred") boolean peakPositionInferred
) {
    public ChartEntry {
        if (track == null && album == null) {
            throw new ChartValidationException("Chart entry at rank " + rank + " has neither track nor collection");
        }
        if (track != null && album != null) {
            throw new ChartValidationException("Chart entry at rank " + rank + " has both track and collection");
        }
        if (rank <= 0) {
            throw new ChartValidationException("Chart entry rank must be positive, got " + rank);
        }
        if (weeksOnChart < 0 || lastWeek < 0 || peakPosition < 0) {
            throw new ChartValidationException("Chart entry at rank " + rank + " has a negative position field");
        }
    }

    public static ChartEntry ofTrack(Track track, int rank, int weeksOnChart, int lastWeek, int peakPosition, boolean peakInferred) {
        return new ChartEntry(track, null, rank, weeksOnChart, lastWeek, peakPosition, peakInferred);
    }

    public static ChartEntry ofAlbum(Album album, int rank, int weeksOnChart, int lastWeek, int peakPosition, boolean peakInferred) {
        return new ChartEntry(null, album, rank, weeksOnChart, lastWeek, peakPosition, peakInferred);
    }

    @JsonIgnore
    public EntryKind kind() {
        return track != null ? EntryKind.TRACK : EntryKind.COLLECTION;
    }

    @JsonIgnore
    public String title() {
        return track != null ? track.title() : album.title();
    }

    @JsonIgnore
    public String primaryArtist() {
        return track != null ? track.artist() : album.artist();
    }

    @JsonIgnore
    public List<String> artists() {
        return track != null ? track.artists() : album.artists();
    }

    /**
     * Zero means the entry is new this week, or the page did not say.
     */
    @JsonIgnore
    public boolean isNewEntry() {
        return lastWeek == 0;
    }
}
