package com.pfesentinel.service;

import java.util.Objects;

/**
 * Typed, immutable configuration of the monitor service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    private final int httpPort;
    private final String detectionConfigPath;
    private final int mlWorkers;
    private final int defaultLookbackHours;

    private MonitorConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.detectionConfigPath = b.detectionConfigPath;
        this.mlWorkers = b.mlWorkers;
        this.defaultLookbackHours = b.defaultLookbackHours;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link MonitorConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MonitorConfig fromEnvironment() {
        try {
            return new Builder()
                    .httpPort(parseIntEnv("HTTP_PORT", "8080"))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .mlWorkers(parseIntEnv("ML_WORKERS", String.valueOf(defaultWorkers())))
                    .defaultLookbackHours(parseIntEnv("DEFAULT_LOOKBACK_HOURS", "1"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    /**
     * @return path of the detection YAML, or an empty string to use the
     *         bundled default
     */
    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    public int getMlWorkers() {
        return mlWorkers;
    }

    public int getDefaultLookbackHours() {
        return defaultLookbackHours;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * {@link #build()} checks that the port is in [0, 65535] (0 binds an
     * ephemeral port) and that worker count and lookback are positive.
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String detectionConfigPath = "";
        private int mlWorkers = defaultWorkers();
        private int defaultLookbackHours = 1;

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder mlWorkers(int v) {
            this.mlWorkers = v;
            return this;
        }

        public Builder defaultLookbackHours(int v) {
            this.defaultLookbackHours = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MonitorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public MonitorConfig build() {
            Objects.requireNonNull(detectionConfigPath, "detectionConfigPath required");
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (mlWorkers < 1) {
                throw new IllegalArgumentException("mlWorkers must be >= 1, got: " + mlWorkers);
            }
            if (defaultLookbackHours < 1) {
                throw new IllegalArgumentException(
                        "defaultLookbackHours must be >= 1, got: " + defaultLookbackHours);
            }
            return new MonitorConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "httpPort=" + httpPort +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                ", mlWorkers=" + mlWorkers +
                ", defaultLookbackHours=" + defaultLookbackHours +
                '}';
    }
}
