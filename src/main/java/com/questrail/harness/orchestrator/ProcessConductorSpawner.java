package com.questrail.harness.orchestrator;

import com.questrail.harness.backend.BackendStrategy;
import com.questrail.harness.conductor.Conductor;
import com.questrail.harness.config.ConductorConfigGenerator;
import com.questrail.harness.config.ConfigSeedArgs;
import com.questrail.harness.config.DefaultConductorConfigGenerator;
import com.questrail.harness.config.GlobalConfig;
import com.questrail.harness.error.ConductorConnectionException;
import com.questrail.harness.error.HarnessException;
import com.questrail.harness.util.Futures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * ProcessConductorSpawner
 * =============================================================================
 * Spawns conductors as local subprocesses.
 *
 * <p>For every spawn a fresh working directory is created, a conductor config
 * with a free admin port is written into it, and the conductor command is
 * started with the config path as its last argument. The process is ready
 * once a line of its output matches the ready pattern; its output is logged
 * line by line. A process that exits or stays silent past the startup
 * timeout is destroyed and the spawn fails with
 * {@link ConductorConnectionException}.</p>
 *
 * <p>The returned conductor uses a {@link BackendStrategy.Local} backend.
 * Killing it destroys the process ({@code SIGKILL} destroys forcibly) and
 * waits for it to exit.</p>
 */
public final class ProcessConductorSpawner implements ConductorSpawner
{
    private static final Logger log = LoggerFactory.getLogger(ProcessConductorSpawner.class);

    private final List<String> command;
    private final Path workDir;
    private final String host;
    private final Pattern readyPattern;
    private final Duration startupTimeout;
    private final ConductorConfigGenerator generator;
    private final String runId;

    private final AtomicInteger spawnCount = new AtomicInteger();

    private ProcessConductorSpawner(Builder b)
    {
        this.command = List.copyOf(b.command);
        this.workDir = b.workDir;
        this.host = b.host;
        this.readyPattern = b.readyPattern;
        this.startupTimeout = b.startupTimeout;
        this.generator = b.generator;
        this.runId = b.runId;
    }

    @Override
    public CompletableFuture<Conductor> spawn(String playerName, GlobalConfig global, ConductorFactory factory)
    {
        Process process;
        int adminPort;
        try {
            adminPort = freePort();
            Path dir = Files.createDirectories(
                    workDir.resolve(runId).resolve(playerName + "-" + spawnCount.incrementAndGet()));
            ConfigSeedArgs seed = new ConfigSeedArgs(adminPort, 0, dir, runId, playerName);
            Path configFile = dir.resolve("conductor-config.yml");
            Files.writeString(configFile, generator.generate(seed, global), StandardCharsets.UTF_8);

            List<String> cmd = new ArrayList<>(command);
            cmd.add(configFile.toString());
            log.info("Starting conductor '{}': {}", playerName, cmd);
            process = new ProcessBuilder(cmd)
                    .directory(dir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException | UncheckedIOException e) {
            return CompletableFuture.failedFuture(
                    new ConductorConnectionException(playerName, "could not start conductor process", e));
        }

        return watchOutput(playerName, process)
                .orTimeout(startupTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error != null) {
                        process.destroyForcibly();
                        throw new ConductorConnectionException(
                                playerName, "conductor process did not become ready", Futures.unwrap(error));
                    }
                    return factory.create(
                            playerName,
                            new BackendStrategy.Local(host, adminPort, 0),
                            signal -> terminate(process, signal));
                });
    }

    private CompletableFuture<Void> watchOutput(String playerName, Process process)
    {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try (BufferedReader out = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = out.readLine()) != null) {
                    log.info("[{}] {}", playerName, line);
                    if (!ready.isDone() && readyPattern.matcher(line).find()) {
                        ready.complete(null);
                    }
                }
            } catch (IOException e) {
                log.debug("Output of conductor '{}' closed", playerName, e);
            }
            process.onExit().thenAccept(p -> ready.completeExceptionally(new HarnessException(
                    "Conductor process '" + playerName + "' exited with code " + p.exitValue())));
        }, "conductor-output-" + playerName);
        reader.setDaemon(true);
        reader.start();
        return ready;
    }

    private static CompletableFuture<Void> terminate(Process process, Optional<String> signal)
    {
        if (signal.filter("SIGKILL"::equalsIgnoreCase).isPresent()) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
        return process.onExit().thenAccept(p -> log.info("Conductor process {} exited with code {}", p.pid(), p.exitValue()));
    }

    private static int freePort() throws IOException
    {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private List<String> command = List.of("holochain", "-c");
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "conductor-harness");
        private String host = "localhost";
        private Pattern readyPattern = Pattern.compile("Conductor ready\\.");
        private Duration startupTimeout = Duration.ofSeconds(30);
        private ConductorConfigGenerator generator = DefaultConductorConfigGenerator.INSTANCE;
        private String runId = UUID.randomUUID().toString();

        /**
         * Conductor command; the config file path is appended as the last argument.
         */
        public Builder withCommand(List<String> command)
        {
            this.command = command;
            return this;
        }

        public Builder withWorkDir(Path workDir)
        {
            this.workDir = workDir;
            return this;
        }

        public Builder withHost(String host)
        {
            this.host = host;
            return this;
        }

        public Builder withReadyPattern(Pattern readyPattern)
        {
            this.readyPattern = readyPattern;
            return this;
        }

        public Builder withStartupTimeout(Duration startupTimeout)
        {
            this.startupTimeout = startupTimeout;
            return this;
        }

        public Builder withConfigGenerator(ConductorConfigGenerator generator)
        {
            this.generator = generator;
            return this;
        }

        public Builder withRunId(String runId)
        {
            this.runId = runId;
            return this;
        }

        public ProcessConductorSpawner build()
        {
            Objects.requireNonNull(command, "command");
            if (command.isEmpty()) {
                throw new IllegalStateException("command must not be empty");
            }
            Objects.requireNonNull(workDir, "workDir");
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(readyPattern, "readyPattern");
            Objects.requireNonNull(startupTimeout, "startupTimeout");
            Objects.requireNonNull(generator, "generator");
            Objects.requireNonNull(runId, "runId");
            return new ProcessConductorSpawner(this);
        }
    }
}
