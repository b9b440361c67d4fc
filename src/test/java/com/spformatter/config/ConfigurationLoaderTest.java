package com.spformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultConfig() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getGeneralConfig("indentSize", 0)).isEqualTo(4);
        assertThat(config.getSectionConfig(FormatterConfig.BLANK_LINES, "maxConsecutiveEmptyLines", 0)).isEqualTo(2);
        assertThat(config.getIgnoreFiles()).containsExactly("**/include/sourcemod*.inc", "build/**");
        assertThat(ConfigurationLoader.loadDefaultConfig()).isSameAs(config);
    }

    @Test
    void testLoadsValuesAndDropsOutOfRange() throws IOException {
        Path file = tempDir.resolve(".spformatter.yml");
        Files.writeString(file, "general:\n"
                + "  indentSize: 2\n"
                + "spacing:\n"
                + "  spaceAfterComma: false\n"
                + "blankLines:\n"
                + "  maxConsecutiveEmptyLines: 99\n");

        FormattingOptions options = FormattingOptions.fromConfig(ConfigurationLoader.loadConfig(file));

        assertThat(options.getIndentSize()).isEqualTo(2);
        assertThat(options.isSpaceAfterComma()).isFalse();
        assertThat(options.getMaxConsecutiveEmptyLines()).isEqualTo(2);
        assertThat(options.isSpaceAroundOperators()).isTrue();
    }

    @Test
    void testMissingFileFallsBackToDefaults() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertThat(config).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testNullPathFallsBackToDefaults() {
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testInvalidYamlFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n  indentSize: : :\n");

        assertThat(ConfigurationLoader.loadConfig(file)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testUnknownLineEndingBecomesLf() throws IOException {
        Path file = tempDir.resolve("endings.yml");
        Files.writeString(file, "general:\n  lineEnding: weird\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getGeneralConfig("lineEnding", "")).isEqualTo("lf");
        assertThat(FormattingOptions.fromConfig(config).getLineEnding()).isEqualTo("\n");
    }

    @Test
    void testCrlfLineEnding() throws IOException {
        Path file = tempDir.resolve("crlf.yml");
        Files.writeString(file, "general:\n  lineEnding: crlf\n");

        assertThat(FormattingOptions.fromConfig(ConfigurationLoader.loadConfig(file)).getLineEnding())
                .isEqualTo("\r\n");
    }

    @Test
    void testSaveAndReload() throws IOException {
        Path file = tempDir.resolve("nested/dir/.spformatter.yml");

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), file);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(reloaded.getIgnoreFiles()).isEqualTo(List.of("**/include/sourcemod*.inc", "build/**"));
        assertThat(reloaded.getSectionConfig(FormatterConfig.BRACES, "newLineAfterOpenBrace", false)).isTrue();
    }
}
