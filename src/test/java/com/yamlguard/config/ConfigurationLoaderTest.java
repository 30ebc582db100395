package com.yamlguard.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.yamlguard.api.error.Severity;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromBundledResource() {
        GuardConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getIndentStep()).isEqualTo(2);
        assertThat(config.isStrict()).isTrue();
        assertThat(config.getFormat()).isEqualTo("stylish");
        assertThat(config.getFailOn()).isEqualTo(Severity.ERROR);
        assertThat(config.getIncludePatterns()).containsExactly("**/*.yaml", "**/*.yml");
        assertThat(config.getExcludePatterns()).contains("**/node_modules/**");
        assertThat(config.isCi()).isFalse();
        assertThat(ConfigurationLoader.loadDefaultConfig()).isSameAs(config);
    }

    @Test
    void fileValuesOverlayDefaults() throws IOException {
        Path file = tempDir.resolve(".yamlguard.yml");
        Files.writeString(file, "indent:\n  step: 4\nreporter:\n  format: JSONL\n  failOn: warning\nci: true\n");

        GuardConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getIndentStep()).isEqualTo(4);
        assertThat(config.getFormat()).isEqualTo("jsonl");
        assertThat(config.getFailOn()).isEqualTo(Severity.WARNING);
        assertThat(config.isColor()).isTrue();
        assertThat(config.getIncludePatterns()).containsExactly("**/*.yaml", "**/*.yml");
        assertThat(config.isCi()).isTrue();
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("yamlguard.yml");
        Files.writeString(file, "indent:\n  step: 12\n  strict: maybe\nreporter:\n  format: xml\n"
                + "  color: 3\nfiles: not-a-section\n");

        GuardConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getIndentStep()).isEqualTo(2);
        assertThat(config.isStrict()).isTrue();
        assertThat(config.getFormat()).isEqualTo("stylish");
        assertThat(config.isColor()).isTrue();
        assertThat(config.getIncludePatterns()).isNotEmpty();
    }

    @Test
    void unreadableOrMissingFileGivesDefaults() throws IOException {
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "indent: [unclosed\n");

        assertThat(ConfigurationLoader.loadConfig(broken).getIndentStep()).isEqualTo(2);
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml")).getIndentStep()).isEqualTo(2);
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void findsConfigInParentDirectory() throws IOException {
        Path config = tempDir.resolve(".yamlguard.yml");
        Files.writeString(config, "indent:\n  step: 3\n");
        Path nested = Files.createDirectories(tempDir.resolve("a/b"));

        assertThat(ConfigurationLoader.findConfig(nested)).isEqualTo(config.toAbsolutePath());
    }

    @Test
    void writesDefaultConfigOnlyOnce() throws IOException {
        Path target = tempDir.resolve("sub/.yamlguard.yml");

        ConfigurationLoader.writeDefaultConfig(target, false);
        Throwable thrown = catchThrowable(() -> ConfigurationLoader.writeDefaultConfig(target, false));

        assertThat(thrown).isInstanceOf(FileAlreadyExistsException.class);
        assertThat(ConfigurationLoader.loadConfig(target).getIndentStep()).isEqualTo(2);
        assertThat(Files.readString(target)).contains("failOn: \"error\"");
    }

    @Test
    void forceOverwritesExistingConfig() throws IOException {
        Path target = tempDir.resolve(".yamlguard.yml");
        Files.writeString(target, "indent:\n  step: 6\n");

        ConfigurationLoader.writeDefaultConfig(target, true);

        assertThat(ConfigurationLoader.loadConfig(target).getIndentStep()).isEqualTo(2);
    }

    @Test
    void withReturnsModifiedCopy() {
        GuardConfig base = ConfigurationLoader.loadDefaultConfig();
        GuardConfig changed = base.with(GuardConfig.INDENT, "step", 8).withCi(true);

        assertThat(changed.getIndentStep()).isEqualTo(8);
        assertThat(changed.isCi()).isTrue();
        assertThat(base.getIndentStep()).isEqualTo(2);
        assertThat(base.get("missing", "key", "fallback")).isEqualTo("fallback");
    }
}
