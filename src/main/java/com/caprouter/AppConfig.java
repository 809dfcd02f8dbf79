package com.caprouter;

import com.caprouter.guard.JsonGuard;
import com.caprouter.models.ModelEndpointConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Application configuration: document locations, model endpoint and server settings.
 * Command-line flags win over environment variables, which win over defaults.
 */
public class AppConfig {

    private static final String APP_NAME = "Capability-Router";
    static final String CAPABILITIES_RESOURCE = "capabilities.yaml";
    static final String SCOPE_RESOURCE = "PRODUCT_SCOPE.md";

    private final Path capabilitiesPath;
    private final Path scopePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final int maxRetries;
    private final ModelEndpointConfig modelEndpoint;

    private AppConfig(Builder builder, Path capabilitiesPath, Path scopePath, Path logPath, int port) {
        this.capabilitiesPath = capabilitiesPath;
        this.scopePath = scopePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = builder.devMode;
        this.maxRetries = builder.maxRetries;
        this.modelEndpoint = builder.modelEndpoint;
    }

    public Path getCapabilitiesPath() {
        return capabilitiesPath;
    }

    public Path getScopePath() {
        return scopePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public ModelEndpointConfig getModelEndpoint() {
        return modelEndpoint;
    }

    /**
     * Data directory holding the default registry and scope documents.
     * Windows: %APPDATA%\Capability-Router
     * macOS: ~/Library/Application Support/Capability-Router
     * Linux: ~/.local/share/Capability-Router
     */
    public static Path getDataDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    public static Path getLogFilePath() {
        return getDataDirectory().resolve("logs").resolve("capability-router.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail later with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Copies a bundled default document to {@code target} unless it already exists.
     */
    static void seedFromClasspath(String resource, Path target) throws IOException {
        if (Files.exists(target)) {
            return;
        }
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return;
            }
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(in, target);
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path capabilitiesPath = null;
        private Path scopePath = null;
        private int preferredPort = 8000;
        private boolean devMode = false;
        private int maxRetries = JsonGuard.DEFAULT_MAX_RETRIES;
        private final ModelEndpointConfig modelEndpoint = new ModelEndpointConfig();

        public Builder() {
            modelEndpoint.setProvider("ollama");
            modelEndpoint.setBaseUrl("http://localhost:11434");
            modelEndpoint.setModel("gpt-oss:20b");
            modelEndpoint.setTimeoutMs(120_000);
        }

        public Builder capabilitiesPath(String path) {
            if (path != null && !path.isBlank()) {
                this.capabilitiesPath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder scopePath(String path) {
            if (path != null && !path.isBlank()) {
                this.scopePath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder modelProvider(String provider) {
            if (provider != null && !provider.isBlank()) {
                modelEndpoint.setProvider(provider.trim().toLowerCase());
            }
            return this;
        }

        public Builder modelUrl(String url) {
            if (url != null && !url.isBlank()) {
                modelEndpoint.setBaseUrl(url.trim());
            }
            return this;
        }

        public Builder model(String model) {
            if (model != null && !model.isBlank()) {
                modelEndpoint.setModel(model.trim());
            }
            return this;
        }

        public Builder modelApiKey(String apiKey) {
            if (apiKey != null && !apiKey.isBlank()) {
                modelEndpoint.setApiKey(apiKey.trim());
            }
            return this;
        }

        /**
         * Sampling temperature sent to the model; values outside 0..2 are ignored.
         */
        public Builder modelTemperature(double temperature) {
            if (temperature >= 0.0 && temperature <= 2.0) {
                modelEndpoint.setTemperature(temperature);
            }
            return this;
        }

        public Builder modelTimeoutMs(int timeoutMs) {
            if (timeoutMs > 0) {
                modelEndpoint.setTimeoutMs(timeoutMs);
            }
            return this;
        }

        /**
         * Applies CAPROUTER_* environment variables.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            capabilitiesPath(env.get("CAPROUTER_CAPABILITIES"));
            scopePath(env.get("CAPROUTER_SCOPE"));
            modelProvider(env.get("CAPROUTER_MODEL_PROVIDER"));
            modelUrl(env.get("CAPROUTER_MODEL_URL"));
            model(env.get("CAPROUTER_MODEL"));
            modelApiKey(env.get("CAPROUTER_MODEL_API_KEY"));
            Integer port = parseInt(env.get("CAPROUTER_PORT"));
            if (port != null) {
                port(port);
            }
            Integer timeout = parseInt(env.get("CAPROUTER_MODEL_TIMEOUT_MS"));
            if (timeout != null) {
                modelTimeoutMs(timeout);
            }
            Double temperature = parseDouble(env.get("CAPROUTER_MODEL_TEMPERATURE"));
            if (temperature != null) {
                modelTemperature(temperature);
            }
            Integer retries = parseInt(env.get("CAPROUTER_MAX_RETRIES"));
            if (retries != null && retries >= 0) {
                maxRetries(retries);
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--dev".equals(arg)) {
                    this.devMode = true;
                    continue;
                }
                if (!arg.startsWith("--")) {
                    continue;
                }
                String name;
                String value;
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    name = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    name = arg.substring(2);
                    value = args[++i];
                } else {
                    continue;
                }
                applyFlag(name, value);
            }
            return this;
        }

        private void applyFlag(String name, String value) {
            switch (name) {
                case "capabilities":
                    capabilitiesPath(value);
                    break;
                case "scope":
                    scopePath(value);
                    break;
                case "port": {
                    Integer port = parseInt(value);
                    if (port != null) port(port);
                    break;
                }
                case "model-provider":
                    modelProvider(value);
                    break;
                case "model-url":
                    modelUrl(value);
                    break;
                case "model":
                    model(value);
                    break;
                case "model-timeout-ms": {
                    Integer timeout = parseInt(value);
                    if (timeout != null) modelTimeoutMs(timeout);
                    break;
                }
                case "model-temperature": {
                    Double temperature = parseDouble(value);
                    if (temperature != null) modelTemperature(temperature);
                    break;
                }
                case "max-retries": {
                    Integer retries = parseInt(value);
                    if (retries != null && retries >= 0) maxRetries(retries);
                    break;
                }
                default:
                    break;
            }
        }

        private static Integer parseInt(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private static Double parseDouble(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        /**
         * Resolves paths without touching the filesystem or probing ports.
         */
        AppConfig buildUnchecked() {
            Path dataDir = getDataDirectory();
            Path capabilities = capabilitiesPath != null ? capabilitiesPath : dataDir.resolve(CAPABILITIES_RESOURCE);
            Path scope = scopePath != null ? scopePath : dataDir.resolve(SCOPE_RESOURCE);
            return new AppConfig(this, capabilities, scope, getLogFilePath(), preferredPort);
        }

        public AppConfig build() throws IOException {
            Path dataDir = getDataDirectory();
            Files.createDirectories(dataDir);
            Path capabilities = capabilitiesPath;
            if (capabilities == null) {
                capabilities = dataDir.resolve(CAPABILITIES_RESOURCE);
                seedFromClasspath(CAPABILITIES_RESOURCE, capabilities);
            }
            Path scope = scopePath;
            if (scope == null) {
                scope = dataDir.resolve(SCOPE_RESOURCE);
                seedFromClasspath(SCOPE_RESOURCE, scope);
            }
            int port = findAvailablePort(preferredPort);
            return new AppConfig(this, capabilities, scope, getLogFilePath(), port);
        }
    }
}
