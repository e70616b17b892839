package com.automate.CodeAudit.client;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.dto.SccLanguageResult;
import com.automate.CodeAudit.exception.LineCountException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SccClientTest {

    private static final String SCC_OUTPUT = """
            [
              {"Name":"Python","Bytes":5120,"CodeBytes":0,"Lines":120,"Code":90,"Comment":20,"Blank":10,"Complexity":7,"Count":3,"WeightedComplexity":0,"Files":[]},
              {"Name":"YAML","Bytes":300,"CodeBytes":0,"Lines":15,"Code":12,"Comment":2,"Blank":1,"Complexity":0,"Count":1,"WeightedComplexity":0,"Files":[]}
            ]
            """;

    @TempDir
    Path tmp;

    private static SccClient client(String binary, Duration timeout) {
        CodeAuditProperties properties = new CodeAuditProperties();
        properties.getScc().setBinary(binary);
        properties.getScc().setTimeout(timeout);
        return new SccClient(new ObjectMapper(), properties);
    }

    private Path script(String body) throws IOException {
        Path script = tmp.resolve("fake-scc.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }

    @Test
    void parseReadsEveryLanguage() {
        List<SccLanguageResult> results = client("scc", Duration.ofSeconds(5)).parse(SCC_OUTPUT);

        assertThat(results).containsExactly(
                new SccLanguageResult("Python", 3, 120, 10, 20, 90, 7),
                new SccLanguageResult("YAML", 1, 15, 1, 2, 12, 0));
    }

    @Test
    void parseOfEmptyArrayIsNoLanguage() {
        assertThat(client("scc", Duration.ofSeconds(5)).parse("[]")).isEmpty();
    }

    @Test
    void missingFieldIsAnError() {
        String withoutCode = "[{\"Name\":\"Go\",\"Lines\":10,\"Comment\":0,\"Blank\":2,\"Complexity\":1,\"Count\":1}]";

        assertThatThrownBy(() -> client("scc", Duration.ofSeconds(5)).parse(withoutCode))
                .isInstanceOf(LineCountException.class)
                .hasMessageContaining("Malformed line counter output");
    }

    @Test
    void nullCounterIsAnError() {
        String nullCode = "[{\"Name\":\"Go\",\"Lines\":10,\"Code\":null,\"Comment\":0,\"Blank\":2,\"Complexity\":1,\"Count\":1}]";

        assertThatThrownBy(() -> client("scc", Duration.ofSeconds(5)).parse(nullCode))
                .isInstanceOf(LineCountException.class);
    }

    @Test
    void notJsonIsAnError() {
        assertThatThrownBy(() -> client("scc", Duration.ofSeconds(5)).parse("scc: command not found"))
                .isInstanceOf(LineCountException.class);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void countLinesRunsTheBinary() throws IOException {
        Path script = script("cat <<'EOF'\n" + SCC_OUTPUT + "EOF\n");

        List<SccLanguageResult> results = client(script.toString(), Duration.ofSeconds(30)).countLines(tmp);

        assertThat(results).extracting(SccLanguageResult::name).containsExactly("Python", "YAML");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void nonZeroExitIsAnError() throws IOException {
        Path script = script("echo 'partial output'\nexit 3\n");

        assertThatThrownBy(() -> client(script.toString(), Duration.ofSeconds(30)).countLines(tmp))
                .isInstanceOfSatisfying(LineCountException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(3);
                    assertThat(e.getOutput()).contains("partial output");
                });
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void timeoutIsAnError() throws IOException {
        Path script = script("exec sleep 10\n");

        assertThatThrownBy(() -> client(script.toString(), Duration.ofMillis(300)).countLines(tmp))
                .isInstanceOf(LineCountException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void missingBinaryIsAnError() {
        assertThatThrownBy(() -> client(tmp.resolve("no-such-scc").toString(), Duration.ofSeconds(5)).countLines(tmp))
                .isInstanceOf(LineCountException.class)
                .hasMessageContaining("Cannot start line counter");
    }
}
