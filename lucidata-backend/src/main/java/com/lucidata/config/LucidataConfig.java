package com.lucidata.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Process-wide configuration, resolved once at startup and passed to components by reference.
 *
 * <p>Each key is looked up as a Spring property first (e.g. {@code lucidata.database.url}) and as an
 * environment variable second (e.g. {@code DATABASE_URL}). Blank values count as absent.
 *
 * @param database database connection settings
 * @param llm language-model provider settings
 * @param web HTTP boundary settings
 */
public record LucidataConfig(Database database, Llm llm, Web web) {

    static final String DEFAULT_LLM_BASE_URL = "https://api.openai.com";
    static final String DEFAULT_LLM_MODEL = "gpt-4";
    static final int DEFAULT_LLM_TIMEOUT_MS = 30000;
    static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5000;
    static final int DEFAULT_QUERY_TIMEOUT_MS = 30000;

    /**
     * @param url DSN or JDBC URL, null when not configured
     * @param connectionTimeoutMs connect timeout
     * @param queryTimeoutMs statement timeout, 0 disables it
     * @param readOnly whether executed statements run on a read-only connection
     */
    public record Database(String url, int connectionTimeoutMs, int queryTimeoutMs, boolean readOnly) {

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    /**
     * @param apiKey provider API key, null when not configured
     * @param model default model used when a request does not name one
     * @param baseUrl OpenAI-compatible gateway base URL, without the {@code /v1} path
     * @param timeoutMs request timeout for one completion call
     */
    public record Llm(String apiKey, String model, String baseUrl, int timeoutMs) {

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        @Override
        public String toString() {
            return "Llm[apiKey=" + (isEnabled() ? "****" : "<unset>") + ", model=" + model
                    + ", baseUrl=" + baseUrl + ", timeoutMs=" + timeoutMs + "]";
        }
    }

    /**
     * @param allowedOrigins origins accepted for cross-origin requests
     */
    public record Web(List<String> allowedOrigins) {

        public Web {
            allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of("*");
        }
    }

    /**
     * Resolve configuration from a Spring environment.
     *
     * @param environment spring environment
     * @return configuration
     */
    public static LucidataConfig fromEnvironment(Environment environment) {
        Database database = new Database(
                Lookup.getTrimmed(environment, "lucidata.database.url", "DATABASE_URL"),
                Lookup.getInt(environment, "lucidata.database.connection-timeout-ms", "DATABASE_CONNECTION_TIMEOUT_MS", DEFAULT_CONNECTION_TIMEOUT_MS),
                Lookup.getInt(environment, "lucidata.database.query-timeout-ms", "DATABASE_QUERY_TIMEOUT_MS", DEFAULT_QUERY_TIMEOUT_MS),
                Lookup.getBoolean(environment, "lucidata.database.read-only", "DATABASE_READ_ONLY", false)
        );

        String baseUrl = Lookup.getTrimmed(environment, "lucidata.llm.base-url", "LLM_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_LLM_BASE_URL;
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String model = Lookup.getTrimmed(environment, "lucidata.llm.model", "LLM_MODEL");
        if (model == null || model.isBlank()) {
            model = DEFAULT_LLM_MODEL;
        }
        Llm llm = new Llm(
                Lookup.getTrimmed(environment, "lucidata.llm.api-key", "LLM_API_KEY"),
                model,
                baseUrl,
                Lookup.getInt(environment, "lucidata.llm.timeout-ms", "LLM_TIMEOUT_MS", DEFAULT_LLM_TIMEOUT_MS)
        );

        String origins = Lookup.getTrimmed(environment, "lucidata.web.allowed-origins", "ALLOWED_ORIGINS");
        List<String> allowedOrigins = origins == null || origins.isBlank()
                ? List.of("*")
                : Arrays.stream(origins.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();

        return new LucidataConfig(database, llm, new Web(allowedOrigins));
    }

    @Slf4j
    private static final class Lookup {

        private Lookup() {
        }

        static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
            String raw = getTrimmed(environment, propKey, envKey);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value for {} ({}), using default {}", propKey, raw, defaultValue);
                return defaultValue;
            }
        }

        static boolean getBoolean(Environment environment, String propKey, String envKey, boolean defaultValue) {
            String raw = getTrimmed(environment, propKey, envKey);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            String v = raw.toLowerCase(Locale.ROOT);
            if ("true".equals(v) || "false".equals(v)) {
                return Boolean.parseBoolean(v);
            }
            log.warn("Ignoring non-boolean value for {} ({}), using default {}", propKey, raw, defaultValue);
            return defaultValue;
        }

        static String getTrimmed(Environment environment, String propKey, String envKey) {
            if (environment == null) {
                return null;
            }
            String v = environment.getProperty(propKey);
            if (v == null || v.isBlank()) {
                v = environment.getProperty(envKey);
            }
            if (v == null) {
                return null;
            }
            String trimmed = v.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
