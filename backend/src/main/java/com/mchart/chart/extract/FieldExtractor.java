package com.mchart.chart.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tries the strategies for one field in priority order; the first one that finds a value wins.
 */
public final class FieldExtractor<T> {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private final String field;
    private final List<FieldStrategy<T>> strategies;

    public FieldExtractor(String field, List<FieldStrategy<T>> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("Field " + field + " needs at least one strategy");
        }
        this.field = field;
        this.strategies = List.copyOf(strategies);
    }

    @SafeVarargs
    public static <T> FieldExtractor<T> of(String field, FieldStrategy<T>... strategies) {
        return new FieldExtractor<>(field, List.of(strategies));
    }

    public Optional<T> extract(RowContext row) {
        for (FieldStrategy<T> strategy : strategies) {
            Optional<T> value = strategy.extract(row);
            if (value.isPresent()) {
                log.trace("field={} strategy={} value={}", field, strategy.name(), value.get());
                return value;
            }
        }
        return Optional.empty();
    }

    public String field() {
        return field;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(FieldStrategy::name).toList();
    }
}
