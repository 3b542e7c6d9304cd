package org.sudandigitalarchive.mcp.config;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide configuration, resolved once at startup and read-only afterwards.
 * Command-line flags take precedence over environment variables, which take precedence over defaults.
 *
 * @param apiKey          key sent in the x-api-key header of every archive request
 * @param baseUrl         archive API root, without a trailing slash
 * @param bindAddress     address the tool endpoints listen on
 * @param port            port the tool endpoints listen on
 * @param requestTimeout  per-call timeout for archive requests
 * @param connectTimeout  connection timeout for archive requests
 * @param telemetryDir    directory for telemetry JSONL files, or null when telemetry is disabled
 */
public record ServerConfig(
    String apiKey,
    String baseUrl,
    String bindAddress,
    int port,
    Duration requestTimeout,
    Duration connectTimeout,
    Path telemetryDir
) {
    public static final String DEFAULT_BASE_URL = "https://api.sudandigitalarchive.com/sda-api";
    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 8081;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Path DEFAULT_TELEMETRY_DIR =
        Paths.get(System.getProperty("user.home"), ".sda_mcp", "telemetry");

    public ServerConfig {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("An API key is required (--api-key or API_KEY)");
        }
        Objects.requireNonNull(baseUrl, "baseUrl");
        baseUrl = stripTrailingSlash(baseUrl.trim());
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("Base URL must be an http(s) URL: " + baseUrl);
        }
        URI uri;
        try {
            uri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Base URL is not a valid URI: " + baseUrl, e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Base URL has no host: " + baseUrl);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }
        bindAddress = bindAddress == null || bindAddress.isBlank() ? DEFAULT_BIND_ADDRESS : bindAddress;
    }

    /**
     * Configuration with defaults for everything but the key and base URL.
     */
    public static ServerConfig of(String apiKey, String baseUrl) {
        return new ServerConfig(apiKey, baseUrl, DEFAULT_BIND_ADDRESS, DEFAULT_PORT,
            DEFAULT_REQUEST_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, DEFAULT_TELEMETRY_DIR);
    }

    public boolean telemetryEnabled() {
        return telemetryDir != null;
    }

    /**
     * Resolve configuration from command-line flags and environment variables.
     *
     * <pre>
     *   --api-key KEY                    (env API_KEY, required)
     *   --base-url URL                   (env SDA_BASE_URL)
     *   --bind-address ADDR              (env SDA_MCP_BIND_ADDRESS)
     *   --port N                         (env SDA_MCP_PORT)
     *   --request-timeout-seconds N      (env SDA_REQUEST_TIMEOUT_SECONDS)
     *   --telemetry-dir DIR              (env SDA_TELEMETRY_DIR)
     *   --no-telemetry
     * </pre>
     *
     * Flags also accept the --name=value form.
     *
     * @throws IllegalArgumentException on unknown flags, missing values or invalid numbers
     */
    public static ServerConfig fromArgs(String[] args, Map<String, String> env) {
        String apiKey = env.get("API_KEY");
        String baseUrl = env.getOrDefault("SDA_BASE_URL", DEFAULT_BASE_URL);
        String bindAddress = env.getOrDefault("SDA_MCP_BIND_ADDRESS", DEFAULT_BIND_ADDRESS);
        String port = env.get("SDA_MCP_PORT");
        String timeout = env.get("SDA_REQUEST_TIMEOUT_SECONDS");
        String telemetry = env.get("SDA_TELEMETRY_DIR");
        boolean telemetryEnabled = true;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inlineValue = arg.substring(eq + 1);
            }

            if (name.equals("--no-telemetry")) {
                telemetryEnabled = false;
                continue;
            }

            String value;
            if (inlineValue != null) {
                value = inlineValue;
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("Missing value for " + name);
            }

            switch (name) {
                case "--api-key" -> apiKey = value;
                case "--base-url" -> baseUrl = value;
                case "--bind-address" -> bindAddress = value;
                case "--port" -> port = value;
                case "--request-timeout-seconds" -> timeout = value;
                case "--telemetry-dir" -> telemetry = value;
                default -> throw new IllegalArgumentException("Unknown option: " + name);
            }
        }

        Path telemetryDir = null;
        if (telemetryEnabled) {
            telemetryDir = telemetry == null || telemetry.isBlank() ? DEFAULT_TELEMETRY_DIR : Paths.get(telemetry);
        }

        return new ServerConfig(
            apiKey,
            baseUrl,
            bindAddress,
            port == null ? DEFAULT_PORT : parseInt("port", port),
            timeout == null ? DEFAULT_REQUEST_TIMEOUT : Duration.ofSeconds(parseInt("request timeout", timeout)),
            DEFAULT_CONNECT_TIMEOUT,
            telemetryDir);
    }

    private static int parseInt(String what, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Cannot parse %s '%s' as an integer", what, value), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ServerConfig[apiKey=****, baseUrl=" + baseUrl + ", bindAddress=" + bindAddress
            + ", port=" + port + ", requestTimeout=" + requestTimeout + ", connectTimeout=" + connectTimeout
            + ", telemetryDir=" + telemetryDir + "]";
    }
}
