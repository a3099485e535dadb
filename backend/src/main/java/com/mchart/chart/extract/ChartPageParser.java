package com.mchart.chart.extract;

import com.mchart.chart.catalog.ChartDefinition;
import com.mchart.chart.model.ChartPageResult;
import com.mchart.chart.model.RawChartRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Parses one fetched chart page into raw records plus page-level metadata.
 */
public class ChartPageParser {
    private static final Logger log = LoggerFactory.getLogger(ChartPageParser.class);

    private final ChartRowExtractor rowExtractor;
    private final PublishedDateParser dateParser;

    public ChartPageParser(Clock clock) {
        this(new ChartRowExtractor(), new PublishedDateParser(clock));
    }

    public ChartPageParser(ChartRowExtractor rowExtractor, PublishedDateParser dateParser) {
        this.rowExtractor = rowExtractor;
        this.dateParser = dateParser;
    }

    public ChartPageResult parse(
        String html,
        String url,
        ChartDefinition chart,
        boolean includeImages,
        Integer maxEntries
    ) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        LocalDate publishedDate = dateParser.parse(document.text());
        String description = parseDescription(document, chart);
        List<RawChartRecord> records = rowExtractor.extract(document, chart.kind(), includeImages, maxEntries).toList();
        log.debug("Parsed chart={} rows={} publishedDate={}", chart.id(), records.size(), publishedDate);
        return new ChartPageResult(chart.id(), url, publishedDate, description, records);
    }

    String parseDescription(Document document, ChartDefinition chart) {
        Element meta = document.selectFirst("meta[name=description]");
        if (meta != null) {
            String content = meta.attr("content").trim();
            if (!content.isEmpty()) {
                return content;
            }
        }
        return chart.pageDescriptionFallback();
    }
}
