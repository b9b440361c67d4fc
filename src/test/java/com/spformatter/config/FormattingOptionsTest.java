package com.spformatter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class FormattingOptionsTest {

    @Test
    void testDefaults() {
        FormattingOptions options = FormattingOptions.defaults();

        assertThat(options.getIndentSize()).isEqualTo(4);
        assertThat(options.isUseTabs()).isFalse();
        assertThat(options.isSpaceAfterComma()).isTrue();
        assertThat(options.isSpaceBeforeOpenParen()).isFalse();
        assertThat(options.isNewLineAfterOpenBrace()).isTrue();
        assertThat(options.getMaxConsecutiveEmptyLines()).isEqualTo(2);
        assertThat(options.getLinesBetweenFunctions()).isEqualTo(1);
        assertThat(options.isRequireSemicolons()).isTrue();
        assertThat(options.getLineEnding()).isEqualTo("\n");
    }

    @Test
    void testDefaultConfigMatchesDefaults() {
        FormattingOptions fromConfig = FormattingOptions.fromConfig(ConfigurationLoader.loadDefaultConfig());
        FormattingOptions defaults = FormattingOptions.defaults();

        assertThat(fromConfig.getIndentSize()).isEqualTo(defaults.getIndentSize());
        assertThat(fromConfig.getMaxLineLength()).isEqualTo(defaults.getMaxLineLength());
        assertThat(fromConfig.isSortIncludes()).isEqualTo(defaults.isSortIncludes());
        assertThat(fromConfig.getLineEnding()).isEqualTo(defaults.getLineEnding());
    }

    @Test
    void testFromConfigSections() {
        Map<String, Object> general = new HashMap<>();
        general.put("useTabs", true);
        general.put("lineEnding", "cr");
        Map<String, Map<String, Object>> sections = new HashMap<>();
        sections.put(FormatterConfig.INCLUDES, Map.of("sortIncludes", true));
        sections.put(FormatterConfig.SEMICOLONS, Map.of("requireSemicolons", false));

        FormattingOptions options = FormattingOptions.fromConfig(new FormatterConfig(general, sections));

        assertThat(options.isUseTabs()).isTrue();
        assertThat(options.indent(2)).isEqualTo("\t\t");
        assertThat(options.getLineEnding()).isEqualTo("\r");
        assertThat(options.isSortIncludes()).isTrue();
        assertThat(options.isRequireSemicolons()).isFalse();
        assertThat(options.isSpaceAfterComma()).isTrue();
    }

    @Test
    void testIndent() {
        FormattingOptions options = FormattingOptions.builder().indentSize(2).build();

        assertThat(options.indent(0)).isEmpty();
        assertThat(options.indent(3)).isEqualTo("      ");
    }

    @Test
    void testToBuilderKeepsValues() {
        FormattingOptions options = FormattingOptions.builder().indentSize(3).sortIncludes(true).build();
        FormattingOptions copy = options.toBuilder().useTabs(true).build();

        assertThat(copy.getIndentSize()).isEqualTo(3);
        assertThat(copy.isSortIncludes()).isTrue();
        assertThat(copy.isUseTabs()).isTrue();
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> FormattingOptions.builder().indentSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormattingOptions.builder().maxConsecutiveEmptyLines(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FormattingOptions.builder().lineEnding(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIgnoreFilesDefaultToEmpty() {
        FormatterConfig config = new FormatterConfig(new HashMap<>(), new HashMap<>());

        assertThat(config.getIgnoreFiles()).isEqualTo(List.of());
    }
}
