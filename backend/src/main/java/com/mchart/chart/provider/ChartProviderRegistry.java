package com.mchart.chart.provider;

import com.mchart.chart.error.UnknownProviderException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class ChartProviderRegistry {
    private final Map<String, ChartProvider> providers = new LinkedHashMap<>();

    public ChartProviderRegistry(List<ChartProvider> providers) {
        for (ChartProvider provider : providers) {
            this.providers.put(provider.name().toLowerCase(Locale.ROOT), provider);
        }
    }

    public ChartProvider get(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        ChartProvider provider = providers.get(key);
        if (provider == null) {
            throw new UnknownProviderException(name, names());
        }
        return provider;
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }
}
