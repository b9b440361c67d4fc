package com.spformatter.plugins.sourcepawn.spacing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OperatorSpacingNormalizerTest {
    private final OperatorSpacingNormalizer spacing = new OperatorSpacingNormalizer(true);
    private final OperatorSpacingNormalizer removalOnly = new OperatorSpacingNormalizer(false);

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a+b        | a + b",
            "x=-1       | x = -1",
            "a==b       | a == b",
            "x+=5       | x += 5",
            "i ++       | i++",
            "! x        | !x",
            "return -1  | return -1",
            "1e-5       | 1e-5",
            "a&b        | a&b",
            "a<<2       | a << 2"
    })
    void testSpacing(String input, String expected) {
        assertThat(spacing.normalize(input)).isEqualTo(expected);
    }

    @Test
    void testLiteralsAndCommentsAreNotTouched() {
        assertThat(spacing.normalize("x=\"a+b\"")).isEqualTo("x = \"a+b\"");
        assertThat(spacing.normalize("y=1; // a+b")).isEqualTo("y = 1; // a+b");
        assertThat(spacing.normalize("#define X a+b\nz=2")).isEqualTo("#define X a+b\nz = 2");
    }

    @Test
    void testAlreadySpacedTextIsStable() {
        String text = "int x = a * (b - c) / 2;";
        assertThat(spacing.normalize(text)).isEqualTo(text);
        assertThat(spacing.normalize(spacing.normalize("a+b*c"))).isEqualTo("a + b * c");
    }

    @Test
    void testRemovalOnlyKeepsBinaryOperatorsAsWritten() {
        assertThat(removalOnly.normalize("a+b")).isEqualTo("a+b");
        assertThat(removalOnly.normalize("a + b")).isEqualTo("a + b");
        assertThat(removalOnly.normalize("! x")).isEqualTo("!x");
        assertThat(removalOnly.normalize("++ i")).isEqualTo("++i");
    }

    @Test
    void testEmptyInput() {
        assertThat(spacing.normalize("")).isEmpty();
        assertThat(spacing.normalize(null)).isNull();
    }
}
