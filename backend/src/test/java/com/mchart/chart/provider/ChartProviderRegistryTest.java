package com.mchart.chart.provider;

import com.mchart.chart.error.UnknownProviderException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

class ChartProviderRegistryTest {
    private final SpotifyChartProvider spotify = new SpotifyChartProvider();
    private final ChartProviderRegistry registry = new ChartProviderRegistry(List.of(spotify));

    @Test
    void looksUpProvidersByNameIgnoringCase() {
        assertSame(spotify, registry.get(" Spotify "));
        assertThat(registry.names()).containsExactly("spotify");
    }

    @Test
    void unknownProviderListsAvailableOnes() {
        assertThatThrownBy(() -> registry.get("deezer"))
            .isInstanceOf(UnknownProviderException.class)
            .hasMessageContaining("spotify")
            .satisfies(ex -> assertThat(((UnknownProviderException) ex).getAvailableProviders()).containsExactly("spotify"));
    }
}
