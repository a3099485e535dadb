package com.mchart.chart.assembly;

import com.mchart.chart.catalog.ResolvedChart;
import com.mchart.chart.error.ChartValidationException;
import com.mchart.chart.model.Album;
import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartEntry;
import com.mchart.chart.model.ChartKind;
import com.mchart.chart.model.ChartPageResult;
import com.mchart.chart.model.EntryKind;
import com.mchart.chart.model.RawChartRecord;
import com.mchart.chart.model.Track;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the validated chart document from raw records. Performs no I/O.
 */
@Component
public class ChartAssembler {

    public ChartDocument assemble(String source, ResolvedChart chart, ChartPageResult page, Integer maxEntries) {
        ChartKind kind = chart.kind();
        List<ChartEntry> entries = new ArrayList<>(page.records().size());
        for (RawChartRecord record : page.records()) {
            entries.add(toEntry(record, kind));
        }
        // List.sort is stable: equal ranks keep the order they were found in
        entries.sort(Comparator.comparingInt(ChartEntry::rank));
        if (maxEntries != null && maxEntries > 0 && entries.size() > maxEntries) {
            entries = entries.subList(0, maxEntries);
        }

        ChartDescriptor descriptor = new ChartDescriptor(
            source,
            chart.definition().title(),
            page.description(),
            page.url(),
            kind
        );
        return new ChartDocument(descriptor, page.publishedDate(), kind, entries);
    }

    ChartEntry toEntry(RawChartRecord record, ChartKind kind) {
        EntryKind entryKind = record.entryKind();
        if (entryKind != kind.entryKind()) {
            throw new ChartValidationException(
                "Record at rank " + record.rank() + " is a " + (entryKind == null ? "null" : entryKind.tag())
                    + " on a " + kind.tag() + " chart"
            );
        }
        List<String> artists = record.artists().isEmpty() && record.artist() != null && !record.artist().isBlank()
            ? List.of(record.artist())
            : record.artists();
        String primaryArtist = artists.isEmpty() ? record.artist() : artists.get(0);

        if (entryKind == EntryKind.COLLECTION) {
            Album album = new Album(record.title(), primaryArtist, artists, record.image());
            return ChartEntry.ofAlbum(
                album,
                record.rank(),
                record.weeksOnChart(),
                record.lastWeek(),
                record.peakPosition(),
                record.peakPositionInferred()
            );
        }
        Track track = new Track(record.title(), primaryArtist, artists, record.image(), "");
        return ChartEntry.ofTrack(
            track,
            record.rank(),
            record.weeksOnChart(),
            record.lastWeek(),
            record.peakPosition(),
            record.peakPositionInferred()
        );
    }
}
