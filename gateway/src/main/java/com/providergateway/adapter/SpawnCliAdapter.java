package com.providergateway.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.adapter.process.DockerProcessLauncher;
import com.providergateway.adapter.process.ExecutionSpec;
import com.providergateway.adapter.process.ProcessLauncher;
import com.providergateway.adapter.process.SandboxException;
import com.providergateway.adapter.process.SpawnedProcess;
import com.providergateway.error.AdapterException;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.error.Sanitizer;
import com.providergateway.model.AdapterType;
import com.providergateway.model.ChatModels;
import com.providergateway.model.GenerationParameters;
import com.providergateway.model.HealthProbeResult;
import com.providergateway.model.NormalizedResult;
import com.providergateway.model.Provider;
import com.providergateway.model.SpawnCliConfig;
import com.providergateway.model.StreamChunk;
import com.providergateway.service.ResponseNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Runs one external process per request. Everything the process touches is
 * private to the run: working directory, environment, and (when sandboxed) the
 * container. The process tree is killed on completion, cancellation and timeout
 * alike.
 */
@Slf4j
public class SpawnCliAdapter implements ProviderAdapter {

    private static final String MODEL_PLACEHOLDER = "{model}";
    private static final int STDERR_LOG_CHARS = 1024;

    // Unbounded: a queued writer would leave a process blocked on stdin until the deadline.
    private static final ExecutorService STDIN_WRITERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "spawn-cli-stdin");
        t.setDaemon(true);
        return t;
    });

    private final Provider provider;
    private final SpawnCliConfig config;
    private final ProcessLauncher launcher;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Function<String, String> gatewayEnvironment;

    public SpawnCliAdapter(Provider provider, ProcessLauncher launcher, ResponseNormalizer normalizer,
                           ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this(provider, launcher, normalizer, objectMapper, meterRegistry, System::getenv);
    }

    SpawnCliAdapter(Provider provider, ProcessLauncher launcher, ResponseNormalizer normalizer,
                    ObjectMapper objectMapper, MeterRegistry meterRegistry,
                    Function<String, String> gatewayEnvironment) {
        this.provider = provider;
        this.config = (SpawnCliConfig) provider.getAdapterConfig();
        this.launcher = launcher;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.gatewayEnvironment = gatewayEnvironment;
    }

    @Override
    public AdapterType getType() {
        return AdapterType.SPAWN_CLI;
    }

    @Override
    public Mono<NormalizedResult> invoke(AdapterRequest request) {
        Mono<NormalizedResult> call = Mono.using(
                        () -> launcher.launch(executionSpec(request)),
                        process -> Mono.fromCallable(() -> runToCompletion(process, request)),
                        SpawnedProcess::destroyTree)
                .subscribeOn(Schedulers.boundedElastic());
        return Deadlines.bound(call, request.getDeadline(), describe())
                .onErrorMap(error -> ErrorClassifier.classify(error, describe()));
    }

    @Override
    public Flux<StreamChunk> invokeStreaming(AdapterRequest request) {
        Flux<StreamChunk> call = Flux.using(
                        () -> launcher.launch(executionSpec(request)),
                        process -> Flux.defer(() -> {
                            startWriter(process, input(request));
                            return chunks(lines(process, request));
                        }),
                        SpawnedProcess::destroyTree)
                .subscribeOn(Schedulers.boundedElastic());
        return Deadlines.bound(call, request.getDeadline(), describe())
                .onErrorMap(error -> ErrorClassifier.classify(error, describe()));
    }

    @Override
    public Mono<HealthProbeResult> healthCheck(Instant deadline) {
        long started = System.nanoTime();
        AdapterRequest probe = AdapterRequest.builder()
                .requestId("probe-" + provider.getId())
                .externalModelId(provider.getModels().isEmpty() ? "" : provider.getModels().get(0).getExternalId())
                .nativeModelId(provider.getModels().isEmpty() ? "" : provider.getModels().get(0).getNativeId())
                .message(ChatModels.Message.builder().role("user").content("ping").build())
                .parameters(GenerationParameters.builder().maxTokens(1).build())
                .deadline(deadline)
                .probe(true)
                .build();
        String requestSnapshot = Sanitizer.snapshot(config.getCommand() + " " + String.join(" ", arguments(probe)));

        return invoke(probe)
                .map(result -> HealthProbeResult.builder()
                        .success(true)
                        .latencyMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                        .requestSnapshot(requestSnapshot)
                        .responseSnapshot(Sanitizer.snapshot(result.getContent()))
                        .build())
                .onErrorResume(error -> {
                    GatewayException classified = ErrorClassifier.classify(error, describe());
                    return Mono.just(HealthProbeResult.failure(classified.getKind(),
                            Sanitizer.snapshot(classified.getMessage()), requestSnapshot,
                            Duration.ofNanos(System.nanoTime() - started).toMillis()));
                });
    }

    ExecutionSpec executionSpec(AdapterRequest request) {
        Map<String, String> environment = new LinkedHashMap<>();
        for (String name : config.getInheritEnvironment()) {
            String value = gatewayEnvironment.apply(name);
            if (value != null) {
                environment.put(name, value);
            }
        }
        environment.putAll(config.getEnvironment());

        return ExecutionSpec.builder()
                .requestId(request.getRequestId())
                .command(config.getCommand())
                .args(arguments(request))
                .environment(environment)
                .image(config.getSandboxImage())
                .memoryLimit(config.getMemoryLimit())
                .cpuLimit(config.getCpuLimit())
                .build();
    }

    List<String> arguments(AdapterRequest request) {
        List<String> args = new ArrayList<>();
        for (String arg : config.getArgs()) {
            args.add(arg.replace(MODEL_PLACEHOLDER, request.getNativeModelId()));
        }
        if (config.getInputChannel() == SpawnCliConfig.InputChannel.ARGUMENT) {
            args.add(payload(request));
        }
        return args;
    }

    String payload(AdapterRequest request) {
        if (config.getInputFormat() == SpawnCliConfig.InputFormat.TEXT) {
            return request.lastUserContent();
        }
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("model", request.getNativeModelId());
        options.putAll(request.getParameters().toOpenAiFields());
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("messages", request.getMessages());
        input.put("options", options);
        try {
            return objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new AdapterException(ErrorKind.UPSTREAM_ERROR, "Could not encode process input", e);
        }
    }

    private NormalizedResult runToCompletion(SpawnedProcess process, AdapterRequest request) {
        long started = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);
        String output;
        startWriter(process, input(request));
        try {
            output = readBounded(process.stdout());
        } catch (IOException e) {
            if (process.isReleased()) {
                // Killed by timeout or cancellation; the deadline operator reports it.
                return null;
            }
            throw new AdapterException(ErrorKind.UPSTREAM_ERROR, describe() + " I/O failed: " + e.getMessage(), e);
        }

        int exitCode = awaitExit(process, request);
        if (process.isReleased()) {
            return null;
        }
        checkExit(process, exitCode);

        NormalizedResult result;
        if (config.getOutputFormat() == SpawnCliConfig.OutputFormat.JSON_LINES) {
            result = fromJsonLines(output, request);
        } else {
            result = normalizer.normalize(AdapterType.SPAWN_CLI, output, request);
        }
        sample.stop(meterRegistry.timer("gateway.adapter.latency",
                "provider", provider.getSlug(), "type", getType().getWireName(), "operation", "invoke"));
        return result.toBuilder()
                .latencyMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                .build();
    }

    private NormalizedResult fromJsonLines(String output, AdapterRequest request) {
        StringBuilder content = new StringBuilder();
        String finishReason = null;
        ChatModels.Usage usage = null;
        for (String line : output.split("\n")) {
            StreamChunk chunk = normalizer.normalizeChunk(AdapterType.SPAWN_CLI, line);
            if (chunk == null) {
                continue;
            }
            if (chunk.isError()) {
                throw new AdapterException(chunk.getErrorKind(), chunk.getErrorMessage());
            }
            if (chunk.getContent() != null) {
                content.append(chunk.getContent());
            }
            if (chunk.getUsage() != null) {
                usage = chunk.getUsage();
            }
            if (chunk.isTerminal()) {
                finishReason = chunk.getFinishReason();
                break;
            }
        }
        return NormalizedResult.builder()
                .id(request.getRequestId())
                .model(request.getExternalModelId())
                .nativeModel(request.getNativeModelId())
                .content(content.toString())
                .finishReason(finishReason != null ? finishReason : "stop")
                .usage(usage)
                .build();
    }

    private Flux<String> lines(SpawnedProcess process, AdapterRequest request) {
        return Flux.generate(
                () -> new LineReader(new BufferedReader(new InputStreamReader(process.stdout(), StandardCharsets.UTF_8))),
                (state, sink) -> {
                    try {
                        String line = state.reader.readLine();
                        if (line == null) {
                            int exitCode = awaitExit(process, request);
                            if (!process.isReleased()) {
                                checkExit(process, exitCode);
                            }
                            sink.complete();
                            return state;
                        }
                        state.bytes += line.getBytes(StandardCharsets.UTF_8).length + 1;
                        if (state.bytes > config.getMaxOutputBytes()) {
                            sink.error(AdapterException.upstream(describe() + " output exceeded "
                                    + config.getMaxOutputBytes() + " bytes"));
                            return state;
                        }
                        sink.next(line);
                    } catch (IOException e) {
                        if (process.isReleased()) {
                            sink.complete();
                        } else {
                            sink.error(new AdapterException(ErrorKind.UPSTREAM_ERROR,
                                    describe() + " I/O failed: " + e.getMessage(), e));
                        }
                    }
                    return state;
                });
    }

    private Flux<StreamChunk> chunks(Flux<String> lines) {
        Flux<StreamChunk> deltas;
        if (config.getOutputFormat() == SpawnCliConfig.OutputFormat.JSON_LINES) {
            deltas = lines.mapNotNull(line -> normalizer.normalizeChunk(AdapterType.SPAWN_CLI, line));
        } else {
            deltas = lines.index().map(indexed -> StreamChunk.delta(
                    indexed.getT1() == 0 ? indexed.getT2() : "\n" + indexed.getT2()));
        }
        // Clean exit with no terminal chunk of its own finishes normally.
        return deltas.concatWith(Mono.just(StreamChunk.finish("stop", null)));
    }

    private byte[] input(AdapterRequest request) {
        if (config.getInputChannel() == SpawnCliConfig.InputChannel.STDIN) {
            return payload(request).getBytes(StandardCharsets.UTF_8);
        }
        return new byte[0];
    }

    /**
     * Feeds stdin on its own thread while the caller drains stdout. A write blocked
     * on a full pipe ends with the process when the tree is destroyed.
     */
    private void startWriter(SpawnedProcess process, byte[] input) {
        CompletableFuture.runAsync(() -> writeInput(process, input), STDIN_WRITERS);
    }

    private void writeInput(SpawnedProcess process, byte[] input) {
        try (OutputStream stdin = process.stdin()) {
            stdin.write(input);
        } catch (IOException e) {
            // A process may exit without reading its input; its exit code decides the outcome.
            log.debug("{} closed stdin early: {}", describe(), e.getMessage());
        }
    }

    private String readBounded(InputStream stdout) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int read;
        while ((read = stdout.read(chunk)) != -1) {
            if (buffer.size() + read > config.getMaxOutputBytes()) {
                throw AdapterException.upstream(describe() + " output exceeded " + config.getMaxOutputBytes() + " bytes");
            }
            buffer.write(chunk, 0, read);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private int awaitExit(SpawnedProcess process, AdapterRequest request) {
        try {
            Duration remaining = request.remaining();
            return process.waitFor(remaining.isNegative() ? Duration.ZERO : remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterException(ErrorKind.CANCELLED, describe() + " interrupted while waiting for exit", e);
        }
    }

    private void checkExit(SpawnedProcess process, int exitCode) {
        if (exitCode == 0) {
            return;
        }
        if (exitCode == -1) {
            throw AdapterException.timeout(describe() + " did not exit before the deadline");
        }
        String stderr = Sanitizer.redact(process.readStderr(STDERR_LOG_CHARS));
        log.atWarn()
                .addKeyValue("source", "gateway-core")
                .addKeyValue("event", "process_exit")
                .addKeyValue("providerId", provider.getId())
                .addKeyValue("exitCode", exitCode)
                .log("{} exited with {}: {}", process.getLabel(), exitCode, stderr);
        if (process.isSandboxed() && exitCode == DockerProcessLauncher.SETUP_FAILURE_EXIT) {
            throw new SandboxException(describe() + " container could not start (exit " + exitCode + ")");
        }
        throw AdapterException.upstream(describe() + " exited with code " + exitCode);
    }

    private String describe() {
        return getType() + " provider " + provider.getSlug();
    }

    private static final class LineReader {
        private final BufferedReader reader;
        private long bytes;

        private LineReader(BufferedReader reader) {
            this.reader = reader;
        }
    }
}
