package fr.lapetina.weather.aggregator.infrastructure.config;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Root configuration object for the weather aggregator.
 * Designed to be populated from YAML.
 */
public class AggregatorConfig {

    private HttpConfig http = new HttpConfig();
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private GeocodingConfig geocoding = new GeocodingConfig();
    private List<SourceConfig> sources = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public OrchestratorConfig getOrchestrator() { return orchestrator; }
    public void setOrchestrator(OrchestratorConfig orchestrator) { this.orchestrator = orchestrator; }

    public GeocodingConfig getGeocoding() { return geocoding; }
    public void setGeocoding(GeocodingConfig geocoding) { this.geocoding = geocoding; }

    public List<SourceConfig> getSources() { return sources; }
    public void setSources(List<SourceConfig> sources) { this.sources = sources; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Shared HTTP session settings.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 10000;
        private String userAgent = "weather-aggregator/1.0";

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    /**
     * Fan-out settings.
     */
    public static class OrchestratorConfig {
        private long sourceTimeoutMs = 15000;
        private int maxParallelism = 8;
        private String mode = "concurrent";

        public long getSourceTimeoutMs() { return sourceTimeoutMs; }
        public void setSourceTimeoutMs(long sourceTimeoutMs) { this.sourceTimeoutMs = sourceTimeoutMs; }

        public int getMaxParallelism() { return maxParallelism; }
        public void setMaxParallelism(int maxParallelism) { this.maxParallelism = maxParallelism; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }

    /**
     * Geocoding provider settings.
     */
    public static class GeocodingConfig {
        private String baseUrl = "https://geocoding-api.open-meteo.com";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    /**
     * One weather provider entry.
     * {@code type} selects the implementation; {@code baseUrl} overrides its public endpoint.
     */
    public static class SourceConfig {
        private String type;
        private String baseUrl;
        private String apiKeyEnv;
        private String apiKey;
        private boolean enabled = true;

        public SourceConfig() {
        }

        public SourceConfig(String type, String apiKeyEnv) {
            this.type = type;
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        /**
         * Resolves the credential: inline key first, then the named environment variable.
         *
         * @param environment lookup for environment variables
         * @return the key, or null if none is configured
         */
        public String resolveApiKey(Function<String, String> environment) {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey.trim();
            }
            if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
                String value = environment.apply(apiKeyEnv);
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "weather_agg";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
