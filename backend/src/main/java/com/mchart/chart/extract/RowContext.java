package com.mchart.chart.extract;

import com.mchart.chart.model.ChartKind;
import org.jsoup.nodes.Element;

/**
 * One row under extraction, carrying the fields resolved so far. Later strategies may read earlier fields.
 */
public record RowContext(Element row, ChartMarkup markup, ChartKind kind, int rank, String title) {

    public static RowContext start(Element row, ChartMarkup markup, ChartKind kind) {
        return new RowContext(row, markup, kind, 0, "");
    }

    public RowContext withRank(int rank) {
        return new RowContext(row, markup, kind, rank, title);
    }

    public RowContext withTitle(String title) {
        return new RowContext(row, markup, kind, rank, title);
    }
}
