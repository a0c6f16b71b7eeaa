package com.acme.wizard.remote.http;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for the wizard back end. Read from a {@code .env} file when present, else
 * from system environment variables.
 */
public class HttpRemoteConfig {
    private static final Logger logger = LoggerFactory.getLogger(HttpRemoteConfig.class);

    static final String BASE_URL_KEY = "WIZARD_API_BASE_URL";
    static final String TIMEOUT_KEY = "WIZARD_API_TIMEOUT_SECONDS";
    static final String IDEMPOTENCY_HEADER_KEY = "WIZARD_API_IDEMPOTENCY_HEADER";

    public static final String DEFAULT_BASE_URL = "http://localhost:8080";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final String DEFAULT_IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private final String baseUrl;
    private final int timeoutSeconds;
    private final String idempotencyHeader;

    public HttpRemoteConfig(String baseUrl, int timeoutSeconds, String idempotencyHeader) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeoutSeconds = timeoutSeconds;
        this.idempotencyHeader = idempotencyHeader == null || idempotencyHeader.isBlank()
                ? DEFAULT_IDEMPOTENCY_HEADER
                : idempotencyHeader;
    }

    public static HttpRemoteConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return from(dotenv);
    }

    public static HttpRemoteConfig from(Dotenv dotenv) {
        HttpRemoteConfig config = new HttpRemoteConfig(
                get(dotenv, BASE_URL_KEY, DEFAULT_BASE_URL),
                getInt(dotenv, TIMEOUT_KEY, DEFAULT_TIMEOUT_SECONDS),
                get(dotenv, IDEMPOTENCY_HEADER_KEY, DEFAULT_IDEMPOTENCY_HEADER));
        logger.info("Remote step configuration loaded, base URL: {}", config.getBaseUrl());
        return config;
    }

    private static String get(Dotenv dotenv, String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null ? value : defaultValue;
    }

    private static int getInt(Dotenv dotenv, String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public String getIdempotencyHeader() {
        return idempotencyHeader;
    }
}
