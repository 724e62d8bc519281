package com.spice.netlist.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SpiceTokenizer.
 */
class SpiceTokenizerTest {

    @Test
    void testSplitsOnWhitespace() {
        assertThat(new SpiceTokenizer("R1   a\tb  1k").tokenize())
                .containsExactly("R1", "a", "b", "1k");
    }

    @Test
    void testQuotedExpressionStaysOneToken() {
        assertThat(new SpiceTokenizer("M1 d g s b nmos w='1u + 2u' l=0.18u").tokenize())
                .containsExactly("M1", "d", "g", "s", "b", "nmos", "w='1u + 2u'", "l=0.18u");
    }

    @Test
    void testMaterialAbuttingClosingQuoteIsKept() {
        assertThat(new SpiceTokenizer("x='a b'c d").tokenize())
                .containsExactly("x='a b'c", "d");
    }

    @Test
    void testUnterminatedQuoteRunsToEndOfLine() {
        assertThat(new SpiceTokenizer("p='1 + 2 q").tokenize())
                .containsExactly("p='1 + 2 q");
    }

    @Test
    void testBlankLine() {
        assertThat(new SpiceTokenizer("   ").tokenize()).isEmpty();
        assertThat(new SpiceTokenizer(null).tokenize()).isEmpty();
    }
}
