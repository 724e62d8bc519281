package com.spice.netlist.analyzer;

import com.spice.netlist.exception.HierarchyDepthExceededException;
import com.spice.netlist.exception.TopCellNotFoundException;
import com.spice.netlist.model.*;
import com.spice.netlist.parser.SpiceParser;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NetlistAnalyzer: flattening, statistics, model usage and top-cell handling.
 */
class NetlistAnalyzerTest {

    private static final String THREE_LEVELS = """
            .SUBCKT leaf a b
            R1 a b 1k
            .ENDS
            .SUBCKT sub x y
            X1 x mid leaf
            R2 mid y 2k
            .ENDS
            Xtop in out sub
            """;

    @Test
    void testTopLevelStats() {
        NetlistAnalyzer analyzer = analyze("M1 d g s b nmos\nR1 1 0 1k");

        assertThat(analyzer.getStats()).isEqualTo(Map.of("Mosfet", 1, "Resistor", 1));
    }

    @Test
    void testFlattenSingleInstance() {
        NetlistAnalyzer analyzer = analyze("""
            .subckt inv in out
            M1 out in 0 0 nmos
            .ends
            X1 a b inv
            """);

        Circuit flat = analyzer.flatten();

        assertThat(flat.getName()).isEqualTo("top_flat");
        assertThat(flat.getComponents()).hasSize(1);
        Component m1 = flat.getComponents().get(0);
        assertThat(m1).isInstanceOf(Mosfet.class);
        assertThat(m1.getName()).isEqualTo("X1.M1");
        assertThat(m1.getNodes()).containsExactly("b", "a", "0", "0");
        assertThat(analyzer.getTransistorCount()).isEqualTo(1);
        assertThat(analyzer.getModelUsage()).isEqualTo(Map.of("nmos", 1));
    }

    @Test
    void testThreeLevelStats() {
        NetlistAnalyzer analyzer = analyze(THREE_LEVELS);

        Map<String, Integer> stats = analyzer.getStats();
        assertThat(stats).containsEntry("SubcktInstance", 1).doesNotContainKey("Resistor");

        Map<String, Integer> hierarchical = analyzer.getHierarchicalStats();
        assertThat(hierarchical).containsEntry("Resistor", 2).doesNotContainKey("SubcktInstance");
    }

    @Test
    void testNestedNetsArePathScoped() {
        Circuit flat = analyze(THREE_LEVELS).flatten();

        assertThat(flat.getComponents()).extracting(Component::getName)
                .containsExactly("Xtop.X1.R1", "Xtop.R2");
        assertThat(flat.getComponents().get(0).getNodes()).containsExactly("in", "Xtop.mid");
        assertThat(flat.getComponents().get(1).getNodes()).containsExactly("Xtop.mid", "out");
    }

    @Test
    void testLeafSubcktStaysOpaque() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT nfet d g s b
            .ENDS
            .SUBCKT top in out
            X1 out in 0 0 nfet
            .ENDS
            """);

        Circuit flat = analyzer.flatten();

        assertThat(flat.getComponents()).hasSize(1);
        SubcktInstance x1 = (SubcktInstance) flat.getComponents().get(0);
        assertThat(x1.getSubcktName()).isEqualTo("nfet");
        assertThat(analyzer.getModelUsage()).isEqualTo(Map.of("nfet", 1));
        assertThat(analyzer.getUnresolvedSubckts()).isEmpty();
    }

    @Test
    void testUndefinedSubcktIsKeptAndRecorded() {
        NetlistAnalyzer analyzer = analyze("X1 a b missing_cell\nR1 a b 1");

        Circuit flat = analyzer.flatten();

        assertThat(flat.getComponents()).extracting(Component::getName).containsExactly("X1", "R1");
        assertThat(analyzer.getUnresolvedSubckts()).containsExactly("missing_cell");
        assertThat(analyzer.getModelUsage()).containsEntry("missing_cell", 1);
    }

    @Test
    void testGroundIsGlobalAtEveryDepth() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT inner a
            R1 a GND 1
            .ENDS
            .SUBCKT g a
            R1 a gnd 1
            R2 a 0 1
            X1 a inner
            .ENDS
            X1 n g
            R4 n Gnd 1
            """);

        Circuit flat = analyzer.flatten();

        assertThat(flat.getComponents()).hasSize(4);
        assertThat(flat.getComponents()).allSatisfy(c -> assertThat(c.getNodes().get(1)).isEqualTo("0"));
    }

    @Test
    void testSiblingInstancesDoNotShareInternalNets() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT buf in out
            R1 in mid 1
            R2 mid out 1
            .ENDS
            X1 a b buf
            X2 c d buf
            """);

        Circuit flat = analyzer.flatten();

        Set<String> first = internalNets(flat, "X1.");
        Set<String> second = internalNets(flat, "X2.");
        assertThat(first).containsExactly("X1.mid");
        assertThat(second).containsExactly("X2.mid");
        assertThat(first).doesNotContainAnyElementsOf(second);
    }

    @Test
    void testPortCountMismatchIsTolerated() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT two a b
            R1 a b 1
            .ENDS
            X1 n1 two
            X2 p q r two
            """);

        Circuit flat = analyzer.flatten();

        assertThat(flat.getComponents().get(0).getNodes()).containsExactly("n1", "X1.b");
        assertThat(flat.getComponents().get(1).getNodes()).containsExactly("p", "q");
    }

    @Test
    void testFlattenDoesNotModifySource() {
        NetlistAnalyzer analyzer = analyze(THREE_LEVELS);

        Circuit first = analyzer.flatten();
        Circuit second = analyzer.flatten();

        assertThat(second.getComponents()).extracting(Component::getName)
                .containsExactlyElementsOf(first.getComponents().stream().map(Component::getName).toList());
        assertThat(second.getComponents()).extracting(Component::getNodes)
                .containsExactlyElementsOf(first.getComponents().stream().map(Component::getNodes).toList());

        Subckt leaf = analyzer.getCircuit().findSubckt("leaf").orElseThrow();
        assertThat(leaf.getComponents().get(0).getName()).isEqualTo("R1");
        assertThat(leaf.getComponents().get(0).getNodes()).containsExactly("a", "b");
    }

    @Test
    void testTopCellsAndTieBreak() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT beta x
            R1 x 0 1
            .ENDS
            .SUBCKT alpha x
            R2 x 0 1
            .ENDS
            """);

        assertThat(analyzer.getTopCells()).containsExactly("alpha", "beta");
        assertThat(analyzer.findTopCell()).map(Subckt::getName).contains("alpha");
        assertThat(analyzer.flatten().getComponents()).extracting(Component::getName).containsExactly("R2");
    }

    @Test
    void testInstantiatedSubcktsAreNotTopCells() {
        NetlistAnalyzer analyzer = analyze(THREE_LEVELS);

        assertThat(analyzer.getTopCells()).containsExactly("sub");
    }

    @Test
    void testExplicitTopCell() {
        Circuit circuit = new SpiceParser().parse("""
            .SUBCKT beta x
            R1 x 0 1
            .ENDS
            .SUBCKT alpha x
            R2 x 0 1
            .ENDS
            R9 a b 1
            """);

        NetlistAnalyzer analyzer = new NetlistAnalyzer(circuit, "beta");

        assertThat(analyzer.getRootName()).isEqualTo("beta");
        assertThat(analyzer.flatten().getComponents()).extracting(Component::getName).containsExactly("R1");
    }

    @Test
    void testUnknownTopCellFailsAtConstruction() {
        Circuit circuit = new SpiceParser().parse("R1 a b 1");

        assertThatThrownBy(() -> new NetlistAnalyzer(circuit, "nope"))
                .isInstanceOf(TopCellNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void testRecursiveSubcktIsRejected() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT loop a
            R1 a 0 1
            X1 a loop
            .ENDS
            Xtop n loop
            """);

        assertThatThrownBy(analyzer::flatten)
                .isInstanceOfSatisfying(HierarchyDepthExceededException.class,
                        e -> assertThat(e.getInstancePath()).isEqualTo("Xtop.X1"));
    }

    @Test
    void testMaxDepthIsEnforced() {
        Circuit circuit = new SpiceParser().parse(THREE_LEVELS);
        NetlistAnalyzer analyzer = new NetlistAnalyzer(circuit, AnalyzerOptions.builder().maxDepth(1).build());

        assertThatThrownBy(analyzer::flatten).isInstanceOf(HierarchyDepthExceededException.class);
    }

    @Test
    void testSubcktsUsingModel() {
        NetlistAnalyzer analyzer = analyze("""
            .SUBCKT nand a b y
            M1 y a 0 0 nch
            .ENDS
            .SUBCKT inv in out
            M1 out in 0 0 nch
            .ENDS
            .SUBCKT other a
            M1 a a 0 0 pch
            .ENDS
            M9 d g s b nch
            """);

        assertThat(analyzer.getSubcktsUsingModel("nch")).containsExactly("inv", "nand", "top");
        assertThat(analyzer.getSubcktsUsingModel("pch")).containsExactly("other");
        assertThat(analyzer.getSubcktsUsingModel("none")).isEmpty();
    }

    @Test
    void testEmptyCircuit() {
        NetlistAnalyzer analyzer = analyze("* nothing here\n");

        assertThat(analyzer.getStats()).isEmpty();
        assertThat(analyzer.flatten().getComponents()).isEmpty();
        assertThat(analyzer.getTopCells()).isEmpty();
        assertThat(analyzer.getHierarchy().getChildren()).isEmpty();
    }

    private static NetlistAnalyzer analyze(String netlist) {
        return new NetlistAnalyzer(new SpiceParser().parse(netlist));
    }

    private static Set<String> internalNets(Circuit flat, String prefix) {
        Set<String> nets = new HashSet<>();
        for (Component component : flat.getComponents()) {
            List<String> nodes = component.getNodes();
            for (String node : nodes) {
                if (node.startsWith(prefix)) {
                    nets.add(node);
                }
            }
        }
        return nets;
    }
}
