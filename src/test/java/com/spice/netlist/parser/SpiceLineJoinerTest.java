package com.spice.netlist.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SpiceLineJoiner.
 */
class SpiceLineJoinerTest {

    @Test
    void testCommentsAndContinuations() {
        String netlist = """
            * title line
            R1 a b
            + 1k $ load resistor
            C1 a 0 1p
            """;

        List<LogicalLine> lines = join(netlist);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).getLineNumber()).isEqualTo(2);
        assertThat(lines.get(0).getText()).isEqualTo("R1 a b 1k");
        assertThat(lines.get(1).getLineNumber()).isEqualTo(4);
        assertThat(lines.get(1).getText()).isEqualTo("C1 a 0 1p");
    }

    @Test
    void testContinuationAcrossCommentAndBlankLines() {
        String netlist = """
            M1 d g s b nmos

            * sizing
            + w=1u
            + l=0.18u
            """;

        List<LogicalLine> lines = join(netlist);

        assertThat(lines).extracting(LogicalLine::getText)
                .containsExactly("M1 d g s b nmos w=1u l=0.18u");
    }

    @Test
    void testLeadingContinuationStartsStatement() {
        List<LogicalLine> lines = join("+ R1 a b 10\nR2 b 0 20");

        assertThat(lines).extracting(LogicalLine::getText)
                .containsExactly("R1 a b 10", "R2 b 0 20");
    }

    @Test
    void testStripComments() {
        assertThat(SpiceLineJoiner.stripComments("   R1 a b 1k $ note ")).isEqualTo("R1 a b 1k");
        assertThat(SpiceLineJoiner.stripComments("* R1 a b 1k")).isEmpty();
        assertThat(SpiceLineJoiner.stripComments("$ only a comment")).isEmpty();
        assertThat(SpiceLineJoiner.stripComments("   ")).isEmpty();
    }

    @Test
    void testEmptyInput() {
        SpiceLineJoiner joiner = new SpiceLineJoiner("");

        assertThat(joiner.hasNext()).isFalse();
        assertThatThrownBy(joiner::next).isInstanceOf(NoSuchElementException.class);
    }

    private static List<LogicalLine> join(String netlist) {
        List<LogicalLine> lines = new ArrayList<>();
        new SpiceLineJoiner(netlist).forEachRemaining(lines::add);
        return lines;
    }
}
