package com.mchart.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "charts")
public class ChartProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private String proxy;
    private Retry retry = new Retry();
    private Extraction extraction = new Extraction();
    private Isolation isolation = new Isolation();
    private Billboard billboard = new Billboard();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public String getProxy() {
        return proxy;
    }

    public void setProxy(String proxy) {
        this.proxy = proxy == null || proxy.isBlank() ? null : proxy.trim();
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Isolation getIsolation() {
        return isolation;
    }

    public void setIsolation(Isolation isolation) {
        this.isolation = isolation;
    }

    public Billboard getBillboard() {
        return billboard;
    }

    public void setBillboard(Billboard billboard) {
        this.billboard = billboard;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxRetries = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 16000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Extraction {
        private boolean includeImages = true;
        private Integer maxChartEntries;
        private boolean fallbackToDefault = true;

        public boolean isIncludeImages() {
            return includeImages;
        }

        public void setIncludeImages(boolean includeImages) {
            this.includeImages = includeImages;
        }

        public Integer getMaxChartEntries() {
            return maxChartEntries;
        }

        public void setMaxChartEntries(Integer maxChartEntries) {
            this.maxChartEntries = maxChartEntries == null || maxChartEntries <= 0 ? null : maxChartEntries;
        }

        public boolean isFallbackToDefault() {
            return fallbackToDefault;
        }

        public void setFallbackToDefault(boolean fallbackToDefault) {
            this.fallbackToDefault = fallbackToDefault;
        }
    }

    public enum IsolationMode {
        PROCESS,
        IN_PROCESS
    }

    public static class Isolation {
        private IsolationMode mode = IsolationMode.PROCESS;
        private int workerTimeoutSeconds = 300;
        private String javaCommand;
        private String classpath;
        private List<String> jvmArgs = new ArrayList<>(List.of("-Xmx256m"));

        public IsolationMode getMode() {
            return mode == null ? IsolationMode.PROCESS : mode;
        }

        public void setMode(IsolationMode mode) {
            this.mode = mode;
        }

        public int getWorkerTimeoutSeconds() {
            return Math.max(1, workerTimeoutSeconds);
        }

        public void setWorkerTimeoutSeconds(int workerTimeoutSeconds) {
            this.workerTimeoutSeconds = Math.max(1, workerTimeoutSeconds);
        }

        public String getJavaCommand() {
            return javaCommand;
        }

        public void setJavaCommand(String javaCommand) {
            this.javaCommand = javaCommand;
        }

        public String getClasspath() {
            return classpath;
        }

        public void setClasspath(String classpath) {
            this.classpath = classpath;
        }

        public List<String> getJvmArgs() {
            return jvmArgs;
        }

        public void setJvmArgs(List<String> jvmArgs) {
            this.jvmArgs = jvmArgs == null ? new ArrayList<>() : jvmArgs;
        }
    }

    public static class Billboard {
        private String baseUrl = "https://www.billboard.com";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                this.baseUrl = "https://www.billboard.com";
                return;
            }
            String trimmed = baseUrl.trim();
            this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }
    }
}
