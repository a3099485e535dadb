package com.mchart.chart.extract;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the "Week of ..." publication date from page text, defaulting to today.
 */
public class PublishedDateParser {
    private static final Pattern WEEK_OF_NAMED =
        Pattern.compile("Week of\\s+(\\w+)\\s+(\\d{1,2}),\\s+(\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEK_OF_NUMERIC =
        Pattern.compile("Week of\\s+(\\d{1,2})/(\\d{1,2})/(\\d{4})");

    private final Clock clock;

    public PublishedDateParser(Clock clock) {
        this.clock = clock;
    }

    public LocalDate parse(String pageText) {
        return parseNamedMonth(pageText)
            .or(() -> parseNumeric(pageText))
            .orElseGet(() -> LocalDate.now(clock));
    }

    private Optional<LocalDate> parseNamedMonth(String text) {
        Matcher matcher = WEEK_OF_NAMED.matcher(text == null ? "" : text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Month month = monthByName(matcher.group(1));
        if (month == null) {
            return Optional.empty();
        }
        return safeDate(Integer.parseInt(matcher.group(3)), month.getValue(), Integer.parseInt(matcher.group(2)));
    }

    private Optional<LocalDate> parseNumeric(String text) {
        Matcher matcher = WEEK_OF_NUMERIC.matcher(text == null ? "" : text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return safeDate(
            Integer.parseInt(matcher.group(3)),
            Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2))
        );
    }

    private static Month monthByName(String name) {
        try {
            return Month.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Optional<LocalDate> safeDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
