package com.mchart.chart.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchart.chart.error.ChartValidationException;
import com.mchart.config.ChartConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChartDocumentJsonTest {
    private final ObjectMapper objectMapper = ChartConfig.newObjectMapper();

    @Test
    void serializesWithIsoDateAndOmitsAbsentItemGroup() throws Exception {
        ChartDocument document = hot100();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(document));

        assertEquals("2026-01-21", json.get("published_date").asText());
        assertEquals("single", json.get("kind").asText());
        assertEquals("billboard", json.at("/descriptor/source").asText());
        JsonNode first = json.get("entries").get(0);
        assertTrue(first.has("track"));
        assertFalse(first.has("collection"));
        assertEquals(3, first.get("last_week").asInt());
        assertFalse(first.get("peak_position_inferred").asBoolean());
        assertFalse(first.has("kind"));
        assertFalse(json.has("totalEntries"));
    }

    @Test
    void roundTripsThroughJson() throws Exception {
        ChartDocument document = hot100();

        ChartDocument parsed = objectMapper.readValue(objectMapper.writeValueAsBytes(document), ChartDocument.class);

        assertEquals(document, parsed);
        assertEquals(LocalDate.of(2026, 1, 21), parsed.publishedDate());
    }

    @Test
    void rejectsEntriesOfTheWrongKindOrOrder() {
        ChartDescriptor descriptor = new ChartDescriptor("billboard", "Billboard 200", "", "", ChartKind.COLLECTION);
        ChartEntry trackEntry = ChartEntry.ofTrack(new Track("Song A", "Artist X", List.of(), "", ""), 1, 0, 0, 1, true);

        assertThatThrownBy(() -> new ChartDocument(descriptor, LocalDate.of(2026, 1, 21), ChartKind.COLLECTION, List.of(trackEntry)))
            .isInstanceOf(ChartValidationException.class);
        assertThatThrownBy(() -> new ChartDocument(descriptor, LocalDate.of(2026, 1, 21), ChartKind.SINGLE, List.of()))
            .isInstanceOf(ChartValidationException.class);

        List<ChartEntry> outOfOrder = List.of(hot100().entries().get(1), hot100().entries().get(0));
        assertThatThrownBy(() -> new ChartDocument(hot100().descriptor(), LocalDate.of(2026, 1, 21), ChartKind.SINGLE, outOfOrder))
            .isInstanceOf(ChartValidationException.class);
    }

    @Test
    void lookupHelpers() {
        ChartDocument document = hot100();

        assertEquals(2, document.totalEntries());
        assertThat(document.top(1)).extracting(ChartEntry::title).containsExactly("Song A");
        assertThat(document.top(10)).hasSize(2);
        assertThat(document.findByArtist("artist y")).extracting(ChartEntry::rank).containsExactly(2);
        assertThat(document.findByTitle("SONG")).hasSize(2);
        assertThat(document.findByArtist(" ")).isEmpty();
    }

    private static ChartDocument hot100() {
        ChartDescriptor descriptor = new ChartDescriptor(
            "billboard",
            "Billboard Hot 100",
            "The week's most popular songs",
            "https://www.billboard.com/charts/hot-100",
            ChartKind.SINGLE
        );
        List<ChartEntry> entries = List.of(
            ChartEntry.ofTrack(new Track("Song A", "Artist X", List.of("Artist X"), "https://example.com/a.jpg", ""), 1, 2, 3, 1, false),
            ChartEntry.ofTrack(new Track("Song B", "Artist Y", List.of("Artist Y"), "", ""), 2, 5, 1, 1, false)
        );
        return new ChartDocument(descriptor, LocalDate.of(2026, 1, 21), ChartKind.SINGLE, entries);
    }
}
