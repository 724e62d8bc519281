package com.spice.netlist.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Circuit and component copies.
 */
class CircuitTest {

    @Test
    void testCopyIsIndependent() {
        Subckt inv = Subckt.builder().name("inv").build();
        inv.getPorts().addAll(List.of("in", "out"));
        inv.addComponent(Mosfet.builder().name("M1").nodes(List.of("out", "in", "0", "0")).model("nch").build());

        Circuit circuit = Circuit.builder().name("top").build();
        circuit.addSubckt(inv);
        circuit.addComponent(Resistor.builder().name("R1").nodes(List.of("a", "b")).value("1k").build());
        circuit.addModel(Model.builder().name("nch").type("nmos").build());
        circuit.getParameters().put("vdd", "1.8");

        Circuit copy = circuit.copy();
        copy.getComponents().get(0).setName("R2");
        copy.getComponents().get(0).getNodes().set(0, "z");
        copy.getSubcircuits().get(0).getComponents().get(0).getParameters().put("w", "1u");
        copy.getSubcircuits().get(0).getPorts().add("extra");
        copy.getParameters().put("vdd", "0.9");

        assertThat(circuit.getComponents().get(0).getName()).isEqualTo("R1");
        assertThat(circuit.getComponents().get(0).getNodes()).containsExactly("a", "b");
        assertThat(inv.getComponents().get(0).getParameters()).isEmpty();
        assertThat(inv.getPorts()).containsExactly("in", "out");
        assertThat(circuit.getParameters()).containsEntry("vdd", "1.8");
        assertThat(copy.findModel("nch")).isPresent();
    }

    @Test
    void testComponentCopyKeepsVariantFields() {
        VoltageSource source = VoltageSource.builder()
                .name("V1").nodes(List.of("vdd", "0")).dcValue("1.8").acValue("1").build();
        SubcktInstance instance = SubcktInstance.builder()
                .name("X1").nodes(List.of("a")).subcktName("inv").extra(List.of("M=2")).build();

        VoltageSource sourceCopy = source.copy();
        SubcktInstance instanceCopy = instance.copy();

        assertThat(sourceCopy).isEqualTo(source).isNotSameAs(source);
        assertThat(instanceCopy.getSubcktName()).isEqualTo("inv");
        assertThat(instanceCopy.getExtra()).containsExactly("M=2");
    }

    @Test
    void testLastDefinitionWinsOnLookup() {
        Circuit circuit = Circuit.builder().name("top").build();
        circuit.addSubckt(Subckt.builder().name("cell").sourceLine(1).build());
        circuit.addSubckt(Subckt.builder().name("cell").sourceLine(9).build());
        circuit.addModel(Model.builder().name("nch").type("nmos").sourceLine(2).build());
        circuit.addModel(Model.builder().name("nch").type("nmos").sourceLine(7).build());

        assertThat(circuit.findSubckt("cell")).map(Subckt::getSourceLine).contains(9);
        assertThat(circuit.findModel("nch")).map(Model::getSourceLine).contains(7);
        assertThat(circuit.getSubcktsByName()).hasSize(1);
        assertThat(circuit.findSubckt("none")).isEmpty();
    }

    @Test
    void testGroundAliases() {
        assertThat(Nets.isGround("0")).isTrue();
        assertThat(Nets.isGround("gNd")).isTrue();
        assertThat(Nets.isGround("00")).isFalse();
        assertThat(Nets.normalizeGround(List.of("a", "GND", "0"))).containsExactly("a", "0", "0");
        assertThat(Nets.qualify("", "R1")).isEqualTo("R1");
        assertThat(Nets.qualify("X1.X2", "R1")).isEqualTo("X1.X2.R1");
    }
}
