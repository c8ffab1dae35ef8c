package com.flowgraph.infrastructure.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flowgraph.domain.node.adapter.gateway.ICodeSandbox;
import com.flowgraph.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 在独立 python 进程中执行用户代码。
 * <p>
 * 请求与结果经 stdin/stdout 以 JSON 传递，超时后强制结束进程。
 * </p>
 */
@Slf4j
@Component
public class PythonProcessCodeSandbox implements ICodeSandbox {

    private static final String RUNNER_RESOURCE = "python/code_runner.py";
    private static final TypeReference<Map<String, Object>> RESPONSE_REF = new TypeReference<Map<String, Object>>() {};

    private final JsonCodec jsonCodec;
    private final String command;
    private final long timeoutSeconds;
    private final String runnerScript;

    public PythonProcessCodeSandbox(JsonCodec jsonCodec,
                                    @Value("${flowgraph.code-sandbox.command:python3}") String command,
                                    @Value("${flowgraph.code-sandbox.timeout-seconds:30}") long timeoutSeconds) {
        this.jsonCodec = jsonCodec;
        this.command = command;
        this.timeoutSeconds = Math.max(timeoutSeconds, 1L);
        this.runnerScript = loadRunner();
    }

    @Override
    public Object execute(String code, Map<String, Object> kwargs) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("code", code);
        request.put("kwargs", kwargs == null ? new LinkedHashMap<>() : kwargs);
        byte[] payload = jsonCodec.writeValue(request).getBytes(StandardCharsets.UTF_8);

        Process process;
        try {
            process = new ProcessBuilder(List.of(command, "-c", runnerScript)).start();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to start code sandbox: " + ex.getMessage(), ex);
        }
        try {
            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(payload);
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Code execution timed out after " + timeoutSeconds + "s");
            }
            String output = stdout.get();
            if (process.exitValue() != 0) {
                throw new IllegalStateException("Code sandbox exited with " + process.exitValue() + ": " + stderr.get());
            }
            Map<String, Object> response = jsonCodec.readValue(output, RESPONSE_REF);
            if (response == null) {
                throw new IllegalStateException("Code sandbox returned no result");
            }
            if (!Boolean.TRUE.equals(response.get("ok"))) {
                throw new IllegalStateException(String.valueOf(response.get("error")));
            }
            return response.get("result");
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Code execution interrupted", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Failed to read code sandbox output", ex.getCause());
        } finally {
            process.destroyForcibly();
        }
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return StreamUtils.copyToString(stream, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }

    private static String loadRunner() {
        try (InputStream in = new ClassPathResource(RUNNER_RESOURCE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load " + RUNNER_RESOURCE, ex);
        }
    }
}
