package de.mirkosertic.sitesearch.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Central configuration for the site search application.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.sitesearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_SEED_URL = "SITESEARCH_SEED_URL";
    private static final String ENV_REDIS_URL = "REDIS_URL";
    private static final String ENV_SNAPSHOT_PATH = "SITESEARCH_SNAPSHOT_PATH";
    private static final String ENV_CHROMIUM_PATH = "LOCAL_CHROMIUM_PATH";
    private static final String ENV_PORT = "SITESEARCH_PORT";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".sitesearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public static final String STORE_TYPE_REDIS = "redis";
    public static final String STORE_TYPE_MEMORY = "memory";

    // Site
    private String seedUrl = "https://example.com";

    // Crawler settings
    private int batchSize = 20;
    private int threadPoolSize = 5;
    private long revisitWindowMs = Duration.ofHours(6).toMillis();
    private int maxContentLength = 100_000;

    // Fetcher settings
    private boolean browserEnabled = true;
    private @Nullable String browserBinary;
    private long pageLoadTimeoutMs = 120_000;
    private long networkIdleTimeoutMs = 10_000;
    private long networkIdleQuietMs = 500;
    private int fetchRetries = 2;
    private long retryBackoffMs = 1000;
    private int httpTimeoutMs = 30_000;
    private int httpMaxBodyBytes = 5 * 1024 * 1024;
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";
    private String acceptLanguage = "en-US,en;q=0.9";

    // Store settings
    private String storeType = STORE_TYPE_REDIS;
    private String redisUrl = "redis://localhost:6379";

    // Index and search settings
    private String snapshotPath;
    private int maxResults = 50;

    // Server settings
    private int serverPort = 8080;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Built-in defaults without reading any file or environment variable.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.snapshotPath = getConfigDirectory().resolve("index-snapshot.json").toString();
        return config;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: seedUrl={}, storeType={}, snapshotPath={}, deployedMode={}",
                config.seedUrl, config.storeType, config.snapshotPath, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    /**
     * Apply a YAML document on top of the current values. Keys that are absent keep their value.
     */
    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("sitesearch");
        if (root == null) {
            return;
        }

        final Map<String, Object> siteConfig = (Map<String, Object>) root.get("site");
        if (siteConfig != null && siteConfig.get("seed-url") != null) {
            this.seedUrl = resolveVariables(siteConfig.get("seed-url").toString());
        }

        final Map<String, Object> crawlerConfig = (Map<String, Object>) root.get("crawler");
        if (crawlerConfig != null) {
            applyCrawlerConfig(crawlerConfig);
        }

        final Map<String, Object> fetcherConfig = (Map<String, Object>) root.get("fetcher");
        if (fetcherConfig != null) {
            applyFetcherConfig(fetcherConfig);
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) root.get("store");
        if (storeConfig != null) {
            if (storeConfig.get("type") != null) {
                this.storeType = resolveVariables(storeConfig.get("type").toString());
            }
            if (storeConfig.get("redis-url") != null) {
                this.redisUrl = resolveVariables(storeConfig.get("redis-url").toString());
            }
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null && indexConfig.get("snapshot-path") != null) {
            this.snapshotPath = resolveVariables(indexConfig.get("snapshot-path").toString());
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) root.get("search");
        if (searchConfig != null && searchConfig.containsKey("max-results")) {
            this.maxResults = ((Number) searchConfig.get("max-results")).intValue();
        }

        final Map<String, Object> serverConfig = (Map<String, Object>) root.get("server");
        if (serverConfig != null && serverConfig.containsKey("port")) {
            this.serverPort = ((Number) serverConfig.get("port")).intValue();
        }
    }

    private void applyCrawlerConfig(final Map<String, Object> crawlerConfig) {
        if (crawlerConfig.containsKey("batch-size")) {
            this.batchSize = ((Number) crawlerConfig.get("batch-size")).intValue();
        }
        if (crawlerConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) crawlerConfig.get("thread-pool-size")).intValue();
        }
        if (crawlerConfig.containsKey("revisit-window-ms")) {
            this.revisitWindowMs = ((Number) crawlerConfig.get("revisit-window-ms")).longValue();
        }
        if (crawlerConfig.containsKey("max-content-length")) {
            this.maxContentLength = ((Number) crawlerConfig.get("max-content-length")).intValue();
        }
    }

    private void applyFetcherConfig(final Map<String, Object> fetcherConfig) {
        if (fetcherConfig.containsKey("browser-enabled")) {
            this.browserEnabled = (Boolean) fetcherConfig.get("browser-enabled");
        }
        if (fetcherConfig.get("browser-binary") != null) {
            final String binary = resolveVariables(fetcherConfig.get("browser-binary").toString());
            this.browserBinary = binary.isBlank() ? null : binary;
        }
        if (fetcherConfig.containsKey("page-load-timeout-ms")) {
            this.pageLoadTimeoutMs = ((Number) fetcherConfig.get("page-load-timeout-ms")).longValue();
        }
        if (fetcherConfig.containsKey("network-idle-timeout-ms")) {
            this.networkIdleTimeoutMs = ((Number) fetcherConfig.get("network-idle-timeout-ms")).longValue();
        }
        if (fetcherConfig.containsKey("network-idle-quiet-ms")) {
            this.networkIdleQuietMs = ((Number) fetcherConfig.get("network-idle-quiet-ms")).longValue();
        }
        if (fetcherConfig.containsKey("retries")) {
            this.fetchRetries = ((Number) fetcherConfig.get("retries")).intValue();
        }
        if (fetcherConfig.containsKey("retry-backoff-ms")) {
            this.retryBackoffMs = ((Number) fetcherConfig.get("retry-backoff-ms")).longValue();
        }
        if (fetcherConfig.containsKey("http-timeout-ms")) {
            this.httpTimeoutMs = ((Number) fetcherConfig.get("http-timeout-ms")).intValue();
        }
        if (fetcherConfig.containsKey("http-max-body-bytes")) {
            this.httpMaxBodyBytes = ((Number) fetcherConfig.get("http-max-body-bytes")).intValue();
        }
        if (fetcherConfig.get("user-agent") != null) {
            this.userAgent = fetcherConfig.get("user-agent").toString();
        }
        if (fetcherConfig.get("accept-language") != null) {
            this.acceptLanguage = fetcherConfig.get("accept-language").toString();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envSeedUrl = System.getenv(ENV_SEED_URL);
        if (envSeedUrl != null && !envSeedUrl.isBlank()) {
            this.seedUrl = envSeedUrl.trim();
            logger.info("Seed URL from environment: {}", this.seedUrl);
        }

        final String envRedisUrl = System.getenv(ENV_REDIS_URL);
        if (envRedisUrl != null && !envRedisUrl.isBlank()) {
            this.redisUrl = envRedisUrl.trim();
        }

        final String envChromium = System.getenv(ENV_CHROMIUM_PATH);
        if (envChromium != null && !envChromium.isBlank()) {
            this.browserBinary = envChromium.trim();
        }

        final String envPort = System.getenv(ENV_PORT);
        if (envPort != null && !envPort.isBlank()) {
            try {
                this.serverPort = Integer.parseInt(envPort.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {} value: {}", ENV_PORT, envPort);
            }
        }

        final String envSnapshotPath = System.getenv(ENV_SNAPSHOT_PATH);
        if (envSnapshotPath != null && !envSnapshotPath.isBlank()) {
            this.snapshotPath = envSnapshotPath.trim();
            logger.info("Snapshot path from environment: {}", this.snapshotPath);
        }

        // Default snapshot path if not set
        if (this.snapshotPath == null || this.snapshotPath.isEmpty()) {
            this.snapshotPath = getConfigDirectory().resolve("index-snapshot.json").toString();
        }

        // System property for snapshot path
        final String propSnapshotPath = System.getProperty("sitesearch.snapshot.path");
        if (propSnapshotPath != null && !propSnapshotPath.isEmpty()) {
            this.snapshotPath = propSnapshotPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getSeedUrl() {
        return seedUrl;
    }

    public void setSeedUrl(final String seedUrl) {
        this.seedUrl = seedUrl;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(final int batchSize) {
        this.batchSize = batchSize;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(final int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public Duration getRevisitWindow() {
        return Duration.ofMillis(revisitWindowMs);
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(final int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public boolean isBrowserEnabled() {
        return browserEnabled;
    }

    public void setBrowserEnabled(final boolean browserEnabled) {
        this.browserEnabled = browserEnabled;
    }

    public @Nullable String getBrowserBinary() {
        return browserBinary;
    }

    public Duration getPageLoadTimeout() {
        return Duration.ofMillis(pageLoadTimeoutMs);
    }

    public Duration getNetworkIdleTimeout() {
        return Duration.ofMillis(networkIdleTimeoutMs);
    }

    public Duration getNetworkIdleQuietPeriod() {
        return Duration.ofMillis(networkIdleQuietMs);
    }

    public int getFetchRetries() {
        return fetchRetries;
    }

    public void setFetchRetries(final int fetchRetries) {
        this.fetchRetries = fetchRetries;
    }

    public Duration getRetryBackoff() {
        return Duration.ofMillis(retryBackoffMs);
    }

    public void setRetryBackoffMs(final long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public int getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public void setHttpTimeoutMs(final int httpTimeoutMs) {
        this.httpTimeoutMs = httpTimeoutMs;
    }

    public int getHttpMaxBodyBytes() {
        return httpMaxBodyBytes;
    }

    public void setHttpMaxBodyBytes(final int httpMaxBodyBytes) {
        this.httpMaxBodyBytes = httpMaxBodyBytes;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getAcceptLanguage() {
        return acceptLanguage;
    }

    public String getStoreType() {
        return storeType;
    }

    public void setStoreType(final String storeType) {
        this.storeType = storeType;
    }

    public String getRedisUrl() {
        return redisUrl;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(final String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(final int maxResults) {
        this.maxResults = maxResults;
    }

    public int getServerPort() {
        return serverPort;
    }

    public void setServerPort(final int serverPort) {
        this.serverPort = serverPort;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
