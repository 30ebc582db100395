package com.yamlguard.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.yamlguard.api.LintPlugin;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;
import com.yamlguard.config.ConfigurationLoader;
import com.yamlguard.config.GuardConfig;
import com.yamlguard.plugins.FileType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlGuardEngineTest {

    @TempDir
    Path tempDir;

    private YamlGuardEngine engine;

    @BeforeEach
    void setUp() {
        engine = YamlGuardEngine.withDefaultPlugins(ConfigurationLoader.loadDefaultConfig());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void findsYamlFilesAndSkipsExcludedDirectories() throws IOException {
        Path good = write("app.yaml", "a: 1\n");
        Path nested = write("conf/db.yml", "b: 2\n");
        write("node_modules/pkg/ignored.yaml", "c: 3\n");
        write("notes.txt", "not yaml");

        assertThat(engine.findFiles(tempDir)).containsExactly(good, nested);
    }

    @Test
    void regularFileIsItsOwnResult() throws IOException {
        Path file = write("single.yml", "a: 1\n");
        Path text = write("readme.md", "# hi\n");

        assertThat(engine.findFiles(file)).containsExactly(file);
        assertThat(engine.findFiles(text)).isEmpty();
        assertThat(engine.findFiles(tempDir.resolve("missing"))).isEmpty();
    }

    @Test
    void checksDirectoryInFileOrder() throws IOException {
        Path bad = write("a.yaml", "a:\n    b: 1\n");
        Path ok = write("b.yaml", "a:\n  b: 1\n");

        Map<Path, LintResult> results = engine.checkDirectory(tempDir, 2);

        assertThat(results.keySet()).containsExactly(bad, ok);
        assertThat(results.get(bad).isSuccessful()).isFalse();
        assertThat(results.get(ok).isSuccessful()).isTrue();
        assertThat(engine.getProcessedFileCount()).isEqualTo(2);
        assertThat(engine.getSuccessCount()).isEqualTo(1);
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void unreadableFileBecomesFatalFinding() throws IOException {
        Path broken = tempDir.resolve("broken.yaml");
        Files.write(broken, new byte[] {'a', ':', ' ', (byte) 0xC3, (byte) 0x28, '\n'});

        LintResult result = engine.checkFiles(List.of(broken), 1).get(broken);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors())
                .extracting(LintError::getType, LintError::getSeverity)
                .containsExactly(tuple(LintError.TYPE_FILE, Severity.FATAL));
        assertThat(result.getErrors().get(0).getMessage()).startsWith("Error processing file: ");
    }

    @Test
    void pluginFailureBecomesFatalFinding() {
        engine.registerPlugin(FileType.YAML, new LintPlugin() {
            @Override
            public void initialize(GuardConfig config) {
            }

            @Override
            public LintResult check(Path filePath, String content) {
                throw new IllegalStateException("boom");
            }

            @Override
            public LintResult fix(Path filePath, String content) {
                throw new IllegalStateException("boom");
            }
        });

        LintResult result = engine.checkFile(Path.of("x.yaml"), "a: 1\n");

        assertThat(result.getErrors())
                .extracting(LintError::getSeverity, LintError::getMessage)
                .containsExactly(tuple(Severity.FATAL, "Error processing file: boom"));
        assertThat(result.getContent()).isEqualTo("a: 1\n");
    }

    @Test
    void filesLeftUnprocessedAfterTimeoutAreReported() throws IOException {
        Path first = write("first.yaml", "a: 1\n");
        Path second = write("second.yaml", "b: 1\n");
        CountDownLatch never = new CountDownLatch(1);
        YamlGuardEngine slow = new YamlGuardEngine(ConfigurationLoader.loadDefaultConfig(), Duration.ofMillis(200));
        slow.registerPlugin(FileType.YAML, new LintPlugin() {
            @Override
            public void initialize(GuardConfig config) {
            }

            @Override
            public LintResult check(Path filePath, String content) {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
                return LintResult.builder().successful(true).content(content).build();
            }

            @Override
            public LintResult fix(Path filePath, String content) {
                return check(filePath, content);
            }
        });

        Map<Path, LintResult> results = slow.checkFiles(List.of(first, second), 1);

        assertThat(results.keySet()).containsExactly(first, second);
        assertThat(results.values())
                .flatExtracting(LintResult::getErrors)
                .extracting(LintError::getSeverity)
                .containsOnly(Severity.FATAL);
        assertThat(results.get(second).getErrors().get(0).getMessage())
                .isEqualTo("Error processing file: not processed within 200 ms");
    }

    @Test
    void unknownFileTypeIsReported() {
        LintResult result = engine.checkFile(Path.of("script.sh"), "echo hi\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors())
                .extracting(LintError::getType, LintError::getSeverity, LintError::getMessage)
                .containsExactly(tuple(LintError.TYPE_FILE, Severity.ERROR,
                        "No plugin registered for file type: UNKNOWN"));
    }

    @Test
    void fixesFilesWithoutWritingThem() throws IOException {
        Path file = write("fix.yaml", "a:\n    b: 1\n");

        LintResult result = engine.fixFiles(List.of(file), 1).get(file);

        assertThat(result.getContent()).isEqualTo("a:\n  b: 1\n");
        assertThat(result.getAppliedFixes()).hasSize(1);
        assertThat(Files.readString(file)).isEqualTo("a:\n    b: 1\n");
    }

    @Test
    void emptyFileListGivesEmptyResult() {
        assertThat(engine.checkFiles(List.of(), 4)).isEmpty();
        assertThat(engine.hasPluginFor(FileType.YAML)).isTrue();
        assertThat(engine.hasPluginFor(FileType.UNKNOWN)).isFalse();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
