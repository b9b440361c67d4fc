package com.spformatter.plugins.sourcepawn;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.api.FormatterResult;
import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;
import com.spformatter.config.ConfigurationLoader;
import com.spformatter.config.FormatterConfig;

class SourcePawnPluginTest {

    private static final Path FILE = Path.of("plugin.sp");

    private SourcePawnPlugin plugin;

    @BeforeEach
    void setUp() {
        plugin = new SourcePawnPlugin();
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testCleanSource() {
        FormatterResult result = plugin.format(FILE, "int g_Count=0;\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isRecovered()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("int g_Count = 0;\n");
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void testTrailingNewlineFollowsInput() {
        assertThat(plugin.format(FILE, "int a=1;").getFormattedCode()).isEqualTo("int a = 1;");
        assertThat(plugin.format(FILE, "int a=1;\n").getFormattedCode()).isEqualTo("int a = 1;\n");
    }

    @Test
    void testRecoveredSourceReportsWarning() {
        FormatterResult result = plugin.format(FILE, "if(x>0){y();}\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.isRecovered()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("if(x > 0)\n{\n    y();\n}\n");
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity)
                .containsExactly(Severity.WARNING, Severity.INFO);
        assertThat(result.hasErrorsAtLeast(Severity.ERROR)).isFalse();
    }

    @Test
    void testUnformattableSourceIsLeftUnchanged() {
        FormatterResult result = plugin.format(FILE, "}}}");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("}}}");
        assertThat(result.getErrors()).hasSize(3)
                .allSatisfy(error -> assertThat(error.getSeverity()).isEqualTo(Severity.ERROR));
        assertThat(result.hasErrorsAtLeast(Severity.ERROR)).isTrue();
    }

    @Test
    void testInitializeAppliesConfig() {
        Map<String, Object> general = new HashMap<>();
        general.put("indentSize", 2);
        plugin.initialize(new FormatterConfig(general, new HashMap<>()));

        assertThat(plugin.getOptions().getIndentSize()).isEqualTo(2);
        assertThat(plugin.format(FILE, "void F()\n{\nx();\n}").getFormattedCode()).isEqualTo("void F()\n{\n  x();\n}");
    }

    @Test
    void testUnterminatedStringLeavesSourceUnchanged() {
        String source = "public void F()\n{\n    PrintToServer(\"abc);\n}\n";

        FormatterResult result = plugin.format(FILE, source);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getErrors()).extracting(FormatterError::getMessage)
                .anySatisfy(message -> assertThat(message).contains("Unterminated string literal"));
    }

    @Test
    void testDeepNestingIsFatal() {
        String source = "void F()\n{\n" + "if(a){\n".repeat(300) + "}\n".repeat(300) + "}\n";

        FormatterResult result = plugin.format(FILE, source);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.hasErrorsAtLeast(Severity.FATAL)).isTrue();
    }
}
