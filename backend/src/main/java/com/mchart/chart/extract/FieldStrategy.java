package com.mchart.chart.extract;

import java.util.Optional;
import java.util.function.Function;

/**
 * A single named way of finding one field in a row. Empty means "not found here", never an error.
 */
public interface FieldStrategy<T> {

    String name();

    Optional<T> extract(RowContext row);

    static <T> FieldStrategy<T> of(String name, Function<RowContext, Optional<T>> extractor) {
        return new FieldStrategy<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<T> extract(RowContext row) {
                return extractor.apply(row);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
