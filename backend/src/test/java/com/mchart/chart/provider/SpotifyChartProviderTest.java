package com.mchart.chart.provider;

import com.mchart.chart.error.NotSupportedException;
import com.mchart.chart.model.ChartFetchOptions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpotifyChartProviderTest {
    private final SpotifyChartProvider provider = new SpotifyChartProvider();

    @Test
    void everyCallReportsNotSupported() {
        assertTrue(provider.supports(ProviderCapability.LATEST));

        assertThatThrownBy(() -> provider.getLatest("top-50", ChartFetchOptions.defaults()))
            .isInstanceOf(NotSupportedException.class)
            .hasMessageContaining("not yet implemented");
        assertThatThrownBy(provider::listAvailableCharts).isInstanceOf(NotSupportedException.class);
        assertThatThrownBy(() -> provider.getChart("top-50", LocalDate.of(2026, 1, 1), null))
            .isInstanceOf(NotSupportedException.class);
        assertThatThrownBy(() -> provider.search("x", null)).isInstanceOf(NotSupportedException.class);
    }
}
