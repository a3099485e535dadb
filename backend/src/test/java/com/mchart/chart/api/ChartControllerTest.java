package com.mchart.chart.api;

import com.mchart.chart.catalog.ChartCatalog;
import com.mchart.chart.error.ChartFetchException;
import com.mchart.chart.error.ChartValidationException;
import com.mchart.chart.error.InvalidChartException;
import com.mchart.chart.error.NotSupportedException;
import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartEntry;
import com.mchart.chart.model.ChartFetchOptions;
import com.mchart.chart.model.ChartKind;
import com.mchart.chart.model.Track;
import com.mchart.chart.provider.ChartProvider;
import com.mchart.chart.provider.ChartProviderRegistry;
import com.mchart.chart.provider.ProviderCapability;
import com.mchart.config.ChartConfig;
import com.mchart.config.ChartProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChartControllerTest {

    @Mock
    private ChartProvider billboard;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        when(billboard.name()).thenReturn("billboard");
        ChartProperties properties = new ChartProperties();
        properties.getExtraction().setMaxChartEntries(100);
        ChartController controller = new ChartController(new ChartProviderRegistry(List.of(billboard)), properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ChartExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(ChartConfig.newObjectMapper()))
            .build();
    }

    @Test
    void listsProviders() throws Exception {
        mockMvc.perform(get("/api/charts/providers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("billboard"));
    }

    @Test
    void latestChartAppliesQueryOverridesOnTopOfConfiguredDefaults() throws Exception {
        when(billboard.getLatest(eq("hot-100"), any())).thenReturn(document());

        mockMvc.perform(get("/api/charts/billboard/hot-100").param("includeImages", "false").param("maxEntries", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.published_date").value("2026-01-21"))
            .andExpect(jsonPath("$.kind").value("single"))
            .andExpect(jsonPath("$.entries[0].track.title").value("Song A"))
            .andExpect(jsonPath("$.entries[0].collection").doesNotExist());

        verify(billboard).getLatest("hot-100", new ChartFetchOptions(false, 10, true));
    }

    @Test
    void listsChartsOfProvider() throws Exception {
        when(billboard.listAvailableCharts()).thenReturn(List.of(
            new ChartDescriptor("billboard", "Billboard 200", "albums", "https://www.billboard.com/charts/billboard-200", ChartKind.COLLECTION)
        ));

        mockMvc.perform(get("/api/charts/billboard"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].kind").value("collection"));
    }

    @Test
    void unknownProviderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/charts/deezer/hot-100"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("unknown_provider"))
            .andExpect(jsonPath("$.available_providers[0]").value("billboard"));
    }

    @Test
    void invalidChartIsBadRequestWithValidIdentifiers() throws Exception {
        when(billboard.getLatest(eq("nope"), any())).thenThrow(new InvalidChartException("nope", ChartCatalog.identifiers()));

        mockMvc.perform(get("/api/charts/billboard/nope").param("fallback", "false"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_chart"))
            .andExpect(jsonPath("$.valid_charts").value(hasItem("hot-100")));
    }

    @Test
    void historyOnProviderWithoutCapabilityIsNotImplemented() throws Exception {
        when(billboard.getChart(eq("hot-100"), eq(LocalDate.of(2020, 1, 4)), any()))
            .thenThrow(new NotSupportedException("billboard", ProviderCapability.HISTORICAL, "Provider billboard does not support historical"));

        mockMvc.perform(get("/api/charts/billboard/hot-100/history/2020-01-04"))
            .andExpect(status().isNotImplemented())
            .andExpect(jsonPath("$.error").value("not_supported"))
            .andExpect(jsonPath("$.capability").value("HISTORICAL"));
    }

    @Test
    void fetchFailureIsBadGateway() throws Exception {
        when(billboard.getLatest(eq("hot-100"), any()))
            .thenThrow(ChartFetchException.noData("hot-100", "https://www.billboard.com/charts/hot-100"));

        mockMvc.perform(get("/api/charts/billboard/hot-100"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("fetch_failure"))
            .andExpect(jsonPath("$.fetch_error").value("no_data"));
    }

    @Test
    void validationFailureIsServerError() throws Exception {
        when(billboard.getLatest(eq("hot-100"), any())).thenThrow(new ChartValidationException("broken"));

        mockMvc.perform(get("/api/charts/billboard/hot-100"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("validation_failure"));
    }

    private static ChartDocument document() {
        ChartDescriptor descriptor = new ChartDescriptor(
            "billboard", "Billboard Hot 100", "", "https://www.billboard.com/charts/hot-100", ChartKind.SINGLE
        );
        ChartEntry entry = ChartEntry.ofTrack(new Track("Song A", "Artist X", List.of("Artist X"), "", ""), 1, 2, 3, 1, false);
        return new ChartDocument(descriptor, LocalDate.of(2026, 1, 21), ChartKind.SINGLE, List.of(entry));
    }
}
