package com.yuubin.relay;

import com.yuubin.relay.config.RelayProperties;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.data.ProviderDataConnectionFactory;
import com.yuubin.relay.core.exceptions.ConfigException;
import com.yuubin.relay.core.exceptions.RelayException;
import com.yuubin.relay.core.exceptions.SetupException;
import com.yuubin.relay.core.server.RelayServer;
import com.yuubin.relay.core.services.MetricsService;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the relay.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "yuubin-relay", mixinStandardHelpOptions = true, version = "1.0.0", description = "Resilient plugin/tunnel relay.")
public class RelayApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RelayApplication.class);

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    @Option(names = "--plugin", description = "Plugin address (host:port), overrides pluginAddress")
    private String pluginAddress;

    @Option(names = "--control", description = "Tunnel control address (host:port), overrides controlAddress")
    private String controlAddress;

    @Option(names = "--data", description = "Data address (host:port), overrides dataAddress")
    private String dataAddress;

    private RelayServer relayServer;
    private ProviderDataConnectionFactory dataConnections;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * Service to watch for configuration file changes.
     * Only assigned once during startup and read during shutdown.
     */
    private WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        new CommandLine(new RelayApplication()).execute(args);
    }

    /**
     * Bootstraps the relay, starts the dispatch loop, and sets up configuration
     * watching.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Yuubin Relay...");

            RelayProperties props = loadEffectiveConfig();
            this.metricsService = new MetricsService(props);
            this.dataConnections = new ProviderDataConnectionFactory(props);
            this.relayServer = new RelayServer(props, dataConnections, metricsService.getRegistry());
            metricsService.setHealthCheck(() -> relayServer != null && !relayServer.isClosed());

            relayServer.start();
            startDispatchLoop();

            startFileWatcher();
            if (System.getProperty("yuubin.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("yuubin.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (SetupException e) {
            log.error("Startup failed: {}", e.getMessage());
            return 1;
        } catch (RelayException e) {
            log.error("Fatal relay error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Runs the dispatch loop on its own thread; the application stops when it
     * returns.
     */
    private void startDispatchLoop() {
        Thread dispatcher = new Thread(() -> {
            try {
                relayServer.loop();
            } catch (RuntimeException e) {
                log.error("Dispatch loop failed", e);
            } finally {
                stop();
            }
        }, "RelayDispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'help' for available commands.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    /**
     * Reads and processes the next command from the scanner.
     *
     * @param scanner Input scanner.
     * @return True if a command was processed, false if input was closed.
     */
    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase());
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     *
     * @param command The command string.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        String[] parts = command.split("\\s+");
        switch (parts[0]) {
            case "reconnect" -> reconnect(parts.length > 1 ? parts[1] : "tunnel");
            case "reload" -> reloadConfiguration();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reconnect [plugin|tunnel], reload, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void reconnect(String target) {
        ChannelRole role = switch (target) {
            case "plugin" -> ChannelRole.PLUGIN;
            case "tunnel" -> ChannelRole.TUNNEL;
            default -> null;
        };
        if (role == null) {
            log.warn("Unknown reconnect target: {}. Use 'plugin' or 'tunnel'.", target);
            return;
        }
        reconnect(role);
    }

    private void reconnect(ChannelRole role) {
        if (relayServer == null) {
            return;
        }
        try {
            relayServer.reconnect(role);
            log.info("{} reconnected", role.label());
        } catch (SetupException e) {
            log.warn("Reconnect failed: {}", e.getMessage());
        } catch (RelayException e) {
            log.error("Reconnect of {} failed unexpectedly: {}", role.label(), e.getMessage());
        }
    }

    /**
     * Gracefully stops the relay, configuration watcher, and background
     * listeners.
     * Also unregisters the shutdown hook to prevent leaks in test environments.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Yuubin Relay...");

            unregisterShutdownHook();

            if (relayServer != null) {
                relayServer.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // Expected when stop() runs inside the hook itself
                log.trace("Shutdown in progress, hook not removed");
            }
        }
    }

    /**
     * Closes the configuration file watch service.
     */
    private void closeWatchService() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Failed to close watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Reloads the configuration from disk and reconnects the roles whose
     * address changed.
     */
    private void reloadConfiguration() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            RelayProperties newProps = loadEffectiveConfig();

            metricsService.updateProperties(newProps);
            dataConnections.setDataAddress(newProps.getDataAddress());

            Set<ChannelRole> changed = relayServer.updateAddresses(newProps);
            for (ChannelRole role : changed) {
                reconnect(role);
            }
            log.info("Configuration reloaded successfully.");
        } catch (RelayException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Starts a background thread to watch for changes in the configuration file.
     * Uses a debounce mechanism to avoid multiple reloads for a single logical
     * change.
     */
    private void startFileWatcher() {
        Thread watcherThread = new Thread(() -> {
            try {
                Path path = Paths.get(configPath).toAbsolutePath();
                Path parent = path.getParent();
                if (parent == null || !parent.toFile().isDirectory()) {
                    return;
                }

                this.watchService = FileSystems.getDefault().newWatchService();
                parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

                log.info("Watching configuration file for changes: {}", path);
                String fileName = path.getFileName().toString();

                runWatcherLoop(fileName);
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "ConfigWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the configuration file watcher.
     *
     * @param fileName The name of the file to watch.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(String fileName) throws InterruptedException {
        // Debounce: reload only after 1s of silence.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = watchService.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                reloadConfiguration();
            }
        }
    }

    /**
     * Loads the configuration, applies command-line overrides and validates it.
     *
     * @return The effective configuration.
     * @throws ConfigException if the configuration cannot be loaded or is invalid.
     */
    RelayProperties loadEffectiveConfig() {
        RelayProperties props = loadConfig(configPath);
        if (pluginAddress != null) {
            props.setPluginAddress(pluginAddress);
        }
        if (controlAddress != null) {
            props.setControlAddress(controlAddress);
        }
        if (dataAddress != null) {
            props.setDataAddress(dataAddress);
        }
        props.validate();
        return props;
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded RelayProperties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    private RelayProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(RelayProperties.class, new LoaderOptions()));

        RelayProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        RelayProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    /**
     * Attempts to load YAML configuration from a file on disk.
     *
     * @param yaml SnakeYAML instance.
     * @param path File path.
     * @return RelayProperties if successful, null otherwise.
     */
    private RelayProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException | ClassCastException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    /**
     * Attempts to load YAML configuration from a classpath resource.
     *
     * @param yaml SnakeYAML instance.
     * @param path Resource path.
     * @return RelayProperties if successful, null otherwise.
     */
    private RelayProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    // An empty document loads as null
    private static RelayProperties orDefaults(RelayProperties loaded) {
        return loaded == null ? new RelayProperties() : loaded;
    }
}
