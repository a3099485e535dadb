package com.mchart.chart.extract;

import com.mchart.chart.model.ChartKind;
import com.mchart.chart.model.RawChartRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns chart rows into raw records. A row missing rank, title or artist is dropped; a row that
 * fails in any other way is skipped without affecting its neighbours.
 */
public class ChartRowExtractor {
    private static final Logger log = LoggerFactory.getLogger(ChartRowExtractor.class);

    private final ChartMarkup markup;
    private final FieldExtractor<Integer> rank = FieldExtractor.of("rank", RowStrategies.rankFromLabelDigits());
    private final FieldExtractor<String> title = FieldExtractor.of("title", RowStrategies.titleFromTitleElement());
    private final FieldExtractor<String> artist = FieldExtractor.of(
        "artist",
        RowStrategies.artistFromLinks(),
        RowStrategies.artistFromLabels()
    );
    private final FieldExtractor<String> image = FieldExtractor.of("image", RowStrategies.imageFromAttributes());
    private final FieldExtractor<Integer> weeksOnChart = FieldExtractor.of(
        "weeks_on_chart",
        RowStrategies.weeksFromRowText()
    );
    private final FieldExtractor<Integer> lastWeek = FieldExtractor.of(
        "last_week",
        RowStrategies.lastWeekFromLabelSibling(),
        RowStrategies.lastWeekFromLabelGroup(),
        RowStrategies.lastWeekFromRowText()
    );
    private final FieldExtractor<Integer> peakPosition = FieldExtractor.of(
        "peak_position",
        RowStrategies.peakFromTextFragment(),
        RowStrategies.peakFromRowText()
    );

    public ChartRowExtractor() {
        this(ChartMarkup.billboard());
    }

    public ChartRowExtractor(ChartMarkup markup) {
        this.markup = markup;
    }

    /**
     * Lazily extracts every usable row of the page. The stream can be consumed once.
     *
     * @param maxEntries stop after this many usable rows; null for all of them
     */
    public Stream<RawChartRecord> extract(Document document, ChartKind kind, boolean includeImages, Integer maxEntries) {
        Stream<RawChartRecord> records = document.select(markup.rowSelector()).stream()
            .map(row -> extractSafely(row, kind, includeImages))
            .flatMap(Optional::stream);
        if (maxEntries != null && maxEntries > 0) {
            records = records.limit(maxEntries);
        }
        return records;
    }

    public Optional<RawChartRecord> extractRow(Element row, ChartKind kind, boolean includeImages) {
        RowContext ctx = RowContext.start(row, markup, kind);

        Optional<Integer> foundRank = rank.extract(ctx);
        if (foundRank.isEmpty()) {
            return Optional.empty();
        }
        ctx = ctx.withRank(foundRank.get());

        Optional<String> foundTitle = title.extract(ctx);
        if (foundTitle.isEmpty()) {
            return Optional.empty();
        }
        ctx = ctx.withTitle(foundTitle.get());

        Optional<String> foundArtist = artist.extract(ctx);
        if (foundArtist.isEmpty()) {
            log.debug("Dropping row rank={} title={}: no artist found", ctx.rank(), ctx.title());
            return Optional.empty();
        }
        List<String> artists = RowStrategies.splitArtists(foundArtist.get());
        String primaryArtist = artists.isEmpty() ? foundArtist.get() : artists.get(0);

        String imageUrl = includeImages ? image.extract(ctx).orElse("") : "";
        Optional<Integer> foundPeak = peakPosition.extract(ctx);

        return Optional.of(new RawChartRecord(
            ctx.rank(),
            ctx.title(),
            primaryArtist,
            artists,
            imageUrl,
            weeksOnChart.extract(ctx).orElse(0),
            lastWeek.extract(ctx).orElse(0),
            foundPeak.orElse(ctx.rank()),
            foundPeak.isEmpty(),
            kind.entryKind()
        ));
    }

    private Optional<RawChartRecord> extractSafely(Element row, ChartKind kind, boolean includeImages) {
        try {
            return extractRow(row, kind, includeImages);
        } catch (RuntimeException e) {
            log.debug("Skipping malformed chart row: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
