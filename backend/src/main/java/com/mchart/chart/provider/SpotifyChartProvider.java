package com.mchart.chart.provider;

import com.mchart.chart.error.NotSupportedException;
import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartFetchOptions;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Placeholder for Spotify charts. Advertises what a full implementation would offer, but every call
 * reports that it is not implemented yet.
 */
@Service
public class SpotifyChartProvider extends AbstractChartProvider {
    public static final String NAME = "spotify";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return EnumSet.of(ProviderCapability.LATEST, ProviderCapability.LIST_CHARTS);
    }

    @Override
    protected ChartDocument doGetLatest(String chartName, ChartFetchOptions options) {
        throw notImplemented(ProviderCapability.LATEST);
    }

    @Override
    protected List<ChartDescriptor> doListAvailableCharts() {
        throw notImplemented(ProviderCapability.LIST_CHARTS);
    }

    private NotSupportedException notImplemented(ProviderCapability capability) {
        return new NotSupportedException(
            NAME,
            capability,
            "Spotify provider is not yet implemented; it requires Spotify Web API credentials"
        );
    }
}
