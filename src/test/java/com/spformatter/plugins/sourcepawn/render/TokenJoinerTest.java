package com.spformatter.plugins.sourcepawn.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.spacing.OperatorSpacingNormalizer;

class TokenJoinerTest {

    private static TokenJoiner joiner(FormattingOptions options) {
        return new TokenJoiner(options, new OperatorSpacingNormalizer(options.isSpaceAroundOperators()));
    }

    @Test
    void testCallArguments() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("foo", "(", "1", ",", "2", ")", ";"))).isEqualTo("foo(1, 2);");
    }

    @Test
    void testCommaSpacingOption() {
        TokenJoiner joiner = joiner(FormattingOptions.builder().spaceAfterComma(false).build());
        assertThat(joiner.join(List.of("foo", "(", "a", ",", "b", ")"))).isEqualTo("foo(a,b)");
    }

    @Test
    void testPrefixAndPostfixOperatorsStayGlued() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("++", "i"))).isEqualTo("++i");
        assertThat(joiner.join(List.of("i", "--"))).isEqualTo("i--");
        assertThat(joiner.join(List.of("!", "IsValid", "(", "x", ")"))).isEqualTo("!IsValid(x)");
    }

    @Test
    void testUnarySignAfterKeyword() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("return", "-", "1"))).isEqualTo("return -1");
        assertThat(joiner.join(List.of("a", "-", "1"))).isEqualTo("a - 1");
    }

    @Test
    void testControlKeywordParenthesis() {
        TokenJoiner compact = joiner(FormattingOptions.defaults());
        TokenJoiner spaced = joiner(FormattingOptions.builder().spaceBeforeOpenParen(true).build());
        List<String> pieces = List.of("while", "(", "x", ")");
        assertThat(compact.join(pieces)).isEqualTo("while(x)");
        assertThat(spaced.join(pieces)).isEqualTo("while (x)");
    }

    @Test
    void testFieldAccessAndIndexing() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("list", ".", "Push", "(", "g_Items", "[", "0", "]", ")")))
                .isEqualTo("list.Push(g_Items[0])");
    }

    @Test
    void testTernaryAndOldTag() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("a", "?", "b", ":", "c"))).isEqualTo("a ? b : c");
        assertThat(joiner.join(List.of("Float", ":", "x"))).isEqualTo("Float:x");
    }

    @Test
    void testSplitCompoundOperatorIsRejoined() {
        TokenJoiner joiner = joiner(FormattingOptions.defaults());
        assertThat(joiner.join(List.of("x", "+", "=", "1"))).isEqualTo("x += 1");
    }
}
