package com.mchart.chart.provider;

public enum ProviderCapability {
    LATEST,
    HISTORICAL,
    LIST_CHARTS,
    SEARCH
}
