package com.mchart.chart.extract;

import com.mchart.chart.model.ChartKind;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The row-level strategies, one factory per named heuristic.
 */
public final class RowStrategies {
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0]+");
    private static final Pattern WEEKS = Pattern.compile("(\\d+)\\s+weeks?", Pattern.CASE_INSENSITIVE);
    private static final Pattern LW_LABEL = Pattern.compile("^LW\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LW_IN_TEXT = Pattern.compile("LW[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PEAK_FRAGMENT = Pattern.compile("Peak.*?(\\d+)");
    private static final Pattern PEAK_IN_TEXT = Pattern.compile("Peak[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> STATUS_MARKERS = Set.of("NEW", "RE-ENTRY", "RE- ENTRY", "-", "");
    private static final int MIN_ARTIST_LENGTH_EXCLUSIVE = 2;
    private static final int MAX_ARTIST_LENGTH_EXCLUSIVE = 150;

    private RowStrategies() {}

    public static FieldStrategy<Integer> rankFromLabelDigits() {
        return FieldStrategy.of("label-digits", ctx -> {
            for (Element label : ctx.row().select(ctx.markup().labelSelector())) {
                String text = label.ownText().trim();
                if (DIGITS.matcher(text).matches()) {
                    int rank = Integer.parseInt(text);
                    return rank > 0 ? Optional.of(rank) : Optional.empty();
                }
            }
            return Optional.empty();
        });
    }

    public static FieldStrategy<String> titleFromTitleElement() {
        return FieldStrategy.of("title-element", ctx -> {
            Element title = ctx.row().selectFirst(ctx.markup().titleSelector());
            if (title == null) {
                return Optional.empty();
            }
            return nonBlank(normalizeWhitespace(title.text()));
        });
    }

    /**
     * Joins every artist-link text with " &amp; ". On single charts a link repeating the title is skipped.
     */
    public static FieldStrategy<String> artistFromLinks() {
        return FieldStrategy.of("artist-links", ctx -> {
            StringBuilder artist = new StringBuilder();
            for (Element link : ctx.row().select("a[href]")) {
                String href = link.attr("href");
                String text = normalizeWhitespace(link.text());
                if (!href.contains(ctx.markup().artistHrefMarker()) || text.isEmpty()) {
                    continue;
                }
                if (ctx.kind() == ChartKind.SINGLE && text.equals(ctx.title())) {
                    continue;
                }
                if (artist.length() > 0) {
                    artist.append(" & ");
                }
                artist.append(text);
            }
            return nonBlank(artist.toString());
        });
    }

    public static FieldStrategy<String> artistFromLabels() {
        return FieldStrategy.of("artist-labels", ctx -> {
            String preferred = null;
            for (Element label : ctx.row().select(ctx.markup().labelSelector())) {
                String text = normalizeWhitespace(label.text());
                if (!isArtistCandidate(text, ctx.title())) {
                    continue;
                }
                if (isInsideLink(label, ctx.row())) {
                    return Optional.of(text);
                }
                if (preferred == null && looksLikeArtist(text)) {
                    preferred = text;
                }
            }
            return Optional.ofNullable(preferred);
        });
    }

    public static FieldStrategy<String> imageFromAttributes() {
        return FieldStrategy.of("image-attributes", ctx -> {
            Element img = ctx.row().selectFirst("img");
            if (img == null) {
                return Optional.empty();
            }
            for (String attribute : ctx.markup().imageAttributes()) {
                String url = img.attr(attribute).trim();
                if (url.startsWith("http") && !url.contains(ctx.markup().imagePlaceholderMarker())) {
                    return Optional.of(url);
                }
            }
            return Optional.empty();
        });
    }

    public static FieldStrategy<Integer> weeksFromRowText() {
        return FieldStrategy.of("weeks-row-text", ctx -> firstNumber(WEEKS, ctx.row().text()));
    }

    /**
     * A span whose own text starts with "LW", followed by a sibling holding only the number.
     */
    public static FieldStrategy<Integer> lastWeekFromLabelSibling() {
        return FieldStrategy.of("lw-label-sibling", ctx -> {
            Element lwLabel = findLastWeekLabel(ctx.row());
            if (lwLabel == null) {
                return Optional.empty();
            }
            Element sibling = lwLabel.nextElementSibling();
            if (sibling == null) {
                return Optional.empty();
            }
            return digitsOnly(sibling.text());
        });
    }

    /**
     * Number labels grouped with the "LW" label. Skipped when the group is the row itself, whose
     * first number label is the current rank.
     */
    public static FieldStrategy<Integer> lastWeekFromLabelGroup() {
        return FieldStrategy.of("lw-label-group", ctx -> {
            Element lwLabel = findLastWeekLabel(ctx.row());
            if (lwLabel == null) {
                return Optional.empty();
            }
            Element group = lwLabel.parent();
            if (group == null || group == ctx.row()) {
                return Optional.empty();
            }
            for (Element label : group.select(ctx.markup().labelSelector())) {
                if (label == lwLabel) {
                    continue;
                }
                Optional<Integer> value = digitsOnly(label.text());
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        });
    }

    public static FieldStrategy<Integer> lastWeekFromRowText() {
        return FieldStrategy.of("lw-row-text", ctx -> firstNumber(LW_IN_TEXT, ctx.row().text()));
    }

    public static FieldStrategy<Integer> peakFromTextFragment() {
        return FieldStrategy.of("peak-text-fragment", ctx -> {
            for (Element element : ctx.row().getAllElements()) {
                Optional<Integer> value = firstNumber(PEAK_FRAGMENT, element.ownText());
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        });
    }

    public static FieldStrategy<Integer> peakFromRowText() {
        return FieldStrategy.of("peak-row-text", ctx -> firstNumber(PEAK_IN_TEXT, ctx.row().text()));
    }

    /**
     * Splits on "&amp;" when present, otherwise on ",". Blank pieces are dropped.
     */
    public static List<String> splitArtists(String artist) {
        if (artist == null || artist.isBlank()) {
            return List.of();
        }
        String separator = artist.contains("&") ? "&" : artist.contains(",") ? "," : null;
        if (separator == null) {
            return List.of(artist.trim());
        }
        List<String> artists = new ArrayList<>();
        for (String part : artist.split(Pattern.quote(separator))) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                artists.add(trimmed);
            }
        }
        return artists.isEmpty() ? List.of(artist.trim()) : List.copyOf(artists);
    }

    static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static boolean isArtistCandidate(String text, String title) {
        if (text.isEmpty() || DIGITS.matcher(text).matches() || text.equals(title)) {
            return false;
        }
        if (text.length() <= MIN_ARTIST_LENGTH_EXCLUSIVE || text.length() >= MAX_ARTIST_LENGTH_EXCLUSIVE) {
            return false;
        }
        return !STATUS_MARKERS.contains(text.toUpperCase(Locale.ROOT));
    }

    private static boolean looksLikeArtist(String text) {
        return text.contains("&")
            || text.contains(",")
            || text.length() > 8
            || Character.isUpperCase(text.charAt(0));
    }

    private static boolean isInsideLink(Element element, Element row) {
        for (Element parent = element.parent(); parent != null && parent != row; parent = parent.parent()) {
            if ("a".equals(parent.normalName())) {
                return true;
            }
        }
        return false;
    }

    private static Element findLastWeekLabel(Element row) {
        for (Element span : row.select("span")) {
            if (LW_LABEL.matcher(span.ownText().trim()).find()) {
                return span;
            }
        }
        return null;
    }

    private static Optional<Integer> digitsOnly(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!DIGITS.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return parse(trimmed);
    }

    private static Optional<Integer> firstNumber(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return parse(matcher.group(1));
    }

    private static Optional<Integer> parse(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            // more digits than an int holds; not a chart position
            return Optional.empty();
        }
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
