package com.spformatter.plugins.sourcepawn.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.FormatOutcome;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.plugins.sourcepawn.render.Renderer;

class FragmentFormatterTest {

    private SourcePawnParser parser;
    private FragmentFormatter fragments;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
        fragments = new FragmentFormatter(new Renderer(FormattingOptions.defaults()));
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    @Test
    void testBareExpression() {
        assertThat(fragments.formatFragment("a+b", parser)).contains("a + b");
    }

    @Test
    void testTerminatedStatementKeepsSemicolon() {
        assertThat(fragments.formatFragment("x+=5;", parser)).contains("x += 5;");
    }

    @Test
    void testCall() {
        assertThat(fragments.formatFragment("foo(1,2,3)", parser)).contains("foo(1, 2, 3)");
    }

    @Test
    void testArgumentList() {
        assertThat(fragments.formatFragment("1, 2", parser)).contains("1, 2");
    }

    @Test
    void testCommaSpacingFollowsOptions() {
        FragmentFormatter compact = new FragmentFormatter(
                new Renderer(FormattingOptions.builder().spaceAfterComma(false).build()));

        assertThat(compact.formatFragment("foo(1, 2, 3)", parser)).contains("foo(1,2,3)");
    }

    @ParameterizedTest
    @ValueSource(strings = {"if(x) y();", "for(;;) {}", "while(true) {}", "switch(x) {}"})
    void testControlStatementsAreNotFragments(String source) {
        assertThat(fragments.formatFragment(source, parser)).isEmpty();
    }

    @Test
    void testEmptyInput() {
        assertThat(fragments.formatFragment("", parser)).isEmpty();
        assertThat(fragments.formatFragment("  ;  ", parser)).isEmpty();
    }

    @Test
    void testStrategyKind() {
        assertThat(fragments.kind()).isEqualTo(FormatOutcome.Strategy.FRAGMENT);
    }

    @Test
    void testTrailingLineComment() {
        assertThat(fragments.formatFragment("a+b // sum", parser)).contains("a + b // sum");
    }

    @Test
    void testTrailingBlockComment() {
        assertThat(fragments.formatFragment("a+b /* x */", parser)).contains("a + b /* x */");
        assertThat(fragments.formatFragment("x+=5; /* done */", parser)).contains("x += 5; /* done */");
    }

    @Test
    void testLeadingCommentOnItsOwnLine() {
        assertThat(fragments.formatFragment("// total\na+b", parser)).contains("// total\na + b");
    }

    @Test
    void testCommentOnlyInputIsNotAFragment() {
        assertThat(fragments.formatFragment("// nothing here", parser)).isEmpty();
    }
}
