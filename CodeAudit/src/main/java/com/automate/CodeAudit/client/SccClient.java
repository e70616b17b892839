package com.automate.CodeAudit.client;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.dto.SccLanguageResult;
import com.automate.CodeAudit.exception.LineCountException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the scc line counter on a source folder and reads its JSON report.
 */
@Slf4j
@Component
public class SccClient {

    private final ObjectReader reader;
    private final String binary;
    private final Duration timeout;

    public SccClient(ObjectMapper objectMapper, CodeAuditProperties properties) {
        this.reader = objectMapper.readerFor(new TypeReference<List<SccLanguageResult>>() {})
                .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES,
                        DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES);
        this.binary = properties.getScc().getBinary();
        this.timeout = properties.getScc().getTimeout();
    }

    public List<SccLanguageResult> countLines(Path sourcePath) {
        List<String> command = List.of(binary, sourcePath.toString(), "-f", "json");
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        log.info("EXEC: {}", String.join(" ", command));

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new LineCountException("Cannot start line counter: " + binary, e);
        }

        ExecutorService ex = Executors.newSingleThreadExecutor();
        try {
            Future<String> stdout = ex.submit(() ->
                    new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8));

            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new LineCountException("Line counter timed out after " + timeout, -1, null);
            }
            String output = stdout.get(10, TimeUnit.SECONDS);
            int exit = p.exitValue();
            log.info("EXEC EXIT = {}", exit);
            if (exit != 0) {
                throw new LineCountException("Line counter exited with code " + exit, exit, output);
            }
            return parse(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new LineCountException("Interrupted while counting lines", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new LineCountException("Cannot read line counter output", e);
        } finally {
            ex.shutdownNow();
        }
    }

    /** Parses an scc JSON report; every field of every entry is required. */
    public List<SccLanguageResult> parse(String json) {
        List<SccLanguageResult> results;
        try {
            results = reader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new LineCountException("Malformed line counter output: " + e.getOriginalMessage(), 0, json);
        }
        if (results == null) {
            throw new LineCountException("Malformed line counter output: not a JSON array", 0, json);
        }
        return results;
    }
}
