package com.yamlguard.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GuardCliTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private GuardCli cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new GuardCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), tempDir);
    }

    @Test
    void cleanFilesExitZero() throws IOException {
        write("ok.yaml", "a:\n  b: 1\n");

        int code = cli.run(new String[] {"lint", ".", "--no-color"});

        assertThat(code).isEqualTo(GuardCli.EXIT_OK);
        assertThat(stdout()).contains("No problems found in 1 files");
    }

    @Test
    void findingsExitOneAndNameTheFile() throws IOException {
        write("bad.yaml", "a:\n    b: 1\n");

        int code = cli.run(new String[] {"lint", "bad.yaml", "--no-color"});

        assertThat(code).isEqualTo(GuardCli.EXIT_FINDINGS);
        assertThat(stdout())
                .contains("bad.yaml")
                .contains("2:5  error    key indentation mismatch: expected column 3, found 5  a");
    }

    @Test
    void jsonlReportEndsWithSummary() throws IOException {
        write("bad.yaml", "a:\n    b: 1\n");

        int code = cli.run(new String[] {"lint", "bad.yaml", "--format=jsonl"});

        String[] lines = stdout().split("\\R");
        assertThat(code).isEqualTo(GuardCli.EXIT_FINDINGS);
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).startsWith("{\"file\":\"bad.yaml\",\"type\":\"indentation\"");
        assertThat(lines[1]).isEqualTo(
                "{\"type\":\"summary\",\"files\":1,\"errors\":1,\"warnings\":0,\"info\":0,\"success\":false}");
    }

    @Test
    void ciModePrintsResultLine() throws IOException {
        write("bad.yaml", "a:\n    b: 1\n");

        cli.run(new String[] {"lint", "bad.yaml", "--ci"});

        assertThat(stdout())
                .contains("RESULT:files=1;errors=1;warnings=0;info=0")
                .doesNotContain("\u001B[");
    }

    @Test
    void failOnInfoPassesCleanTree() throws IOException {
        write("list.yaml", "items:\n  - x\n  - y\n");
        write("odd.yaml", "a: {? b : c}\n");

        assertThat(cli.run(new String[] {"lint", ".", "--fail-on=info", "--no-color"}))
                .isEqualTo(GuardCli.EXIT_OK);
    }

    @Test
    void indentOptionOverridesConfig() throws IOException {
        write("wide.yaml", "a:\n    b: 1\n");

        assertThat(cli.run(new String[] {"lint", "wide.yaml", "--indent=4"})).isEqualTo(GuardCli.EXIT_OK);
    }

    @Test
    void configFileInWorkingDirectoryIsUsed() throws IOException {
        write(".yamlguard.yml", "indent:\n  step: 4\n");
        write("wide.yaml", "a:\n    b: 1\n");

        assertThat(cli.run(new String[] {"lint", "wide.yaml"})).isEqualTo(GuardCli.EXIT_OK);
    }

    @Test
    void fixPrintsContentAndLeavesFileAlone() throws IOException {
        Path file = write("bad.yaml", "a:\n    b: 1\n");

        int code = cli.run(new String[] {"fix", "bad.yaml", "--no-color"});

        assertThat(code).isEqualTo(GuardCli.EXIT_OK);
        assertThat(stdout()).isEqualTo("a:\n  b: 1\n");
        assertThat(Files.readString(file)).isEqualTo("a:\n    b: 1\n");
    }

    @Test
    void fixInPlaceWritesFileAndBackup() throws IOException {
        Path file = write("bad.yaml", "a:\n    b: 1\n");

        int code = cli.run(new String[] {"fix", "bad.yaml", "--in-place", "--backup", "--no-color"});

        assertThat(code).isEqualTo(GuardCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo("a:\n  b: 1\n");
        assertThat(Files.readString(tempDir.resolve("bad.yaml.bak"))).isEqualTo("a:\n    b: 1\n");
        assertThat(stdout()).contains("Fixed: ").contains("Re-indented lines 2-2 to 2 spaces per level");
    }

    @Test
    void backupRequiresInPlace() throws IOException {
        write("bad.yaml", "a:\n    b: 1\n");

        assertThat(cli.run(new String[] {"fix", "bad.yaml", "--backup"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(stderr()).contains("--backup requires --in-place");
    }

    @Test
    void initWritesConfigOnceUnlessForced() {
        assertThat(cli.run(new String[] {"init"})).isEqualTo(GuardCli.EXIT_OK);
        assertThat(tempDir.resolve(".yamlguard.yml")).exists();

        assertThat(cli.run(new String[] {"init"})).isEqualTo(GuardCli.EXIT_FINDINGS);
        assertThat(cli.run(new String[] {"init", "--force"})).isEqualTo(GuardCli.EXIT_OK);
    }

    @Test
    void missingPathIsReported() {
        int code = cli.run(new String[] {"lint", "nowhere.yaml", "--no-color"});

        assertThat(code).isEqualTo(GuardCli.EXIT_FINDINGS);
        assertThat(stderr()).contains("Path does not exist");
    }

    @Test
    void usageErrorsExitTwo() {
        assertThat(cli.run(new String[0])).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"frobnicate"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint", ".", "--indent=9"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint", ".", "--indent=two"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint", ".", "--format=xml"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint", ".", "--force"})).isEqualTo(GuardCli.EXIT_USAGE);
        assertThat(cli.run(new String[] {"lint", ".", "--config=absent.yml"})).isEqualTo(GuardCli.EXIT_USAGE);
    }

    @Test
    void printsVersionAndHelp() {
        assertThat(cli.run(new String[] {"--version"})).isEqualTo(GuardCli.EXIT_OK);
        assertThat(cli.run(new String[] {"--help", "--no-color"})).isEqualTo(GuardCli.EXIT_OK);

        assertThat(stdout()).startsWith("yamlguard version 1.0.0").contains("Usage:");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
