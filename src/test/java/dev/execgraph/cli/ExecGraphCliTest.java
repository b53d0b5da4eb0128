package dev.execgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExecGraphCliTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String stdin, String... args) {
        var cli = new ExecGraphCli(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        var commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void convertsStdinToSingleTarget() {
        int exit = run("Sequence { q0, q1, }", "--from", "custom", "--to", "dot");

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_OK);
        assertThat(out.toString()).isEqualTo("""
            digraph ExecutionGraph {
              q0;
              q1;
              q0 -> q1;
            }
            """);
    }

    @Test
    void printsEveryOtherFormatWithHeadings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("graph.mmd");
        Files.writeString(file, "flowchart TD\n    a --> b\n");

        int exit = run("", "--from", "mermaid", file.toString());

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_OK);
        assertThat(out.toString())
            .contains("== custom ==")
            .contains("== dot ==")
            .doesNotContain("== mermaid ==")
            .contains("a -> b;");
    }

    @Test
    void reportsFailedTargetOnStderr() {
        String bowtie = "digraph G { A -> B; A -> C; B -> D; C -> D; B -> C; }";

        int exit = run(bowtie, "--from", "dot");

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_CONVERSION_FAILED);
        assertThat(err.toString()).contains("custom: DECOMPOSITION error");
        assertThat(out.toString()).contains("== mermaid ==");
    }

    @Test
    void jsonOutputCarriesWholeBundle() throws IOException {
        int exit = run("Sequence { a, b, }", "--from", "custom", "--json", "--graph-name", "Demo");

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_OK);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.at("/results/dot/text").asText()).startsWith("digraph Demo {");
        assertThat(root.at("/results/custom/text").asText()).isEqualTo("Sequence { a, b, }");
    }

    @Test
    void jsonOutputIsLimitedToRequestedTarget() throws IOException {
        String bowtie = "digraph G { A -> B; A -> C; B -> D; C -> D; B -> C; }";

        int exit = run(bowtie, "--from", "dot", "--to", "mermaid", "--json");

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_OK);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("results").size()).isEqualTo(1);
        assertThat(root.at("/results/mermaid/ok").asBoolean()).isTrue();
        assertThat(root.at("/results/custom").isMissingNode()).isTrue();
    }

    @Test
    void appliesConfigFileAndOverrides(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("options.json");
        Files.writeString(config, "{\"flowchartDirection\": \"LR\", \"maxNestingDepth\": 1}");

        int exit = run("Sequence { a, Parallel { b, c } }",
            "--from", "custom", "--to", "mermaid", "--config", config.toString(), "--max-depth", "4");

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_OK);
        assertThat(out.toString()).startsWith("flowchart LR\n");
    }

    @Test
    void badConfigIsInputError(@TempDir Path dir) {
        int exit = run("Sequence { a }", "--from", "custom", "--config", dir.resolve("missing.json").toString());

        assertThat(exit).isEqualTo(ExecGraphCli.EXIT_BAD_INPUT);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void unknownFormatIsUsageError() {
        int exit = run("", "--from", "xml");

        assertThat(exit).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown format 'xml'");
    }
}
