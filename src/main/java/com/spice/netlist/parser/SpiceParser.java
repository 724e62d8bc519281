package com.spice.netlist.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.diagnostics.NetlistDiagnostics;
import com.spice.netlist.diagnostics.ParseDiagnostic;
import com.spice.netlist.diagnostics.Severity;
import com.spice.netlist.exception.NetlistParseException;
import com.spice.netlist.model.Bjt;
import com.spice.netlist.model.Capacitor;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;
import com.spice.netlist.model.ComponentContainer;
import com.spice.netlist.model.CurrentSource;
import com.spice.netlist.model.Diode;
import com.spice.netlist.model.Inductor;
import com.spice.netlist.model.Model;
import com.spice.netlist.model.Mosfet;
import com.spice.netlist.model.Resistor;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;
import com.spice.netlist.model.VoltageSource;

/**
 * Parser for SPICE-family netlists (SPICE, HSPICE, CDL).
 * Converts logical lines into a {@link Circuit}.
 *
 * Parsing only:
 * - Builds the AST
 * - Records .INCLUDE/.LIB paths (no file is opened)
 * - Reports diagnostics
 *
 * A line that cannot be understood is reported and skipped; it never aborts the parse.
 * One parser may be reused, but not concurrently.
 */
public class SpiceParser {
    private static final Logger log = LoggerFactory.getLogger(SpiceParser.class);

    public static final String DEFAULT_CIRCUIT_NAME = "top";

    private Circuit circuit;
    private ComponentContainer currentScope;
    private Deque<ComponentContainer> scopeStack;
    private NetlistDiagnostics diagnostics = new NetlistDiagnostics();
    private String sourceFile;

    public Circuit parse(String content) {
        return parse(content, DEFAULT_CIRCUIT_NAME);
    }

    public Circuit parse(String content, String circuitName) {
        return parse(content, circuitName, new NetlistDiagnostics());
    }

    public Circuit parse(String content, String circuitName, NetlistDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.circuit = Circuit.builder()
                .name(circuitName)
                .sourceFile(sourceFile)
                .build();
        this.currentScope = circuit;
        this.scopeStack = new ArrayDeque<>();

        SpiceLineJoiner lines = new SpiceLineJoiner(content);
        while (lines.hasNext()) {
            LogicalLine line = lines.next();
            try {
                parseLine(line);
            } catch (NetlistParseException e) {
                diagnostics.add(ParseDiagnostic.builder()
                        .severity(e.getSeverity())
                        .sourceFile(sourceFile)
                        .line(line.getLineNumber())
                        .sourceText(line.getText())
                        .message(e.getMessage())
                        .build());
                log.debug("Failed to parse line {}: {} ({})", line.getLineNumber(), line.getText(), e.getMessage());
            }
        }

        if (!scopeStack.isEmpty()) {
            diagnostics.add(ParseDiagnostic.builder()
                    .severity(Severity.WARNING)
                    .sourceFile(sourceFile)
                    .message("Missing .ENDS for subcircuit '" + currentScope.getName() + "'")
                    .build());
            log.warn("Missing .ENDS for subcircuit '{}'", currentScope.getName());
        }

        log.debug("Parsed circuit '{}': {} components, {} subcircuits, {} models",
                circuit.getName(), circuit.getComponents().size(),
                circuit.getSubcircuits().size(), circuit.getModels().size());
        return circuit;
    }

    public Circuit parseFile(Path path) throws IOException {
        return parseFile(path, new NetlistDiagnostics());
    }

    /**
     * Reads a netlist from disk. The circuit is named after the file, without extension.
     */
    public Circuit parseFile(Path path, NetlistDiagnostics diagnostics) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        // Malformed bytes decode to U+FFFD; a stray Latin-1 comment must not abort the parse
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);

        log.info("Parsing netlist: {}", path);
        this.sourceFile = path.toString();
        try {
            return parse(content, extractCircuitName(path), diagnostics);
        } finally {
            this.sourceFile = null;
        }
    }

    /**
     * Diagnostics of the most recent parse.
     */
    public NetlistDiagnostics getDiagnostics() {
        return diagnostics;
    }

    private void parseLine(LogicalLine line) {
        List<String> tokens = new SpiceTokenizer(line.getText()).tokenize();
        if (tokens.isEmpty()) {
            return;
        }

        String command = tokens.get(0).toUpperCase(Locale.ROOT);
        if (command.startsWith(".")) {
            parseDirective(command, tokens, line.getLineNumber());
        } else {
            parseComponent(tokens, line.getLineNumber());
        }
    }

    // ---- Directives ----

    private void parseDirective(String command, List<String> tokens, int lineNumber) {
        switch (command) {
            case ".SUBCKT" -> startSubckt(tokens, lineNumber);
            case ".ENDS" -> endSubckt();
            case ".MODEL" -> parseModel(tokens, lineNumber);
            case ".PARAM" -> parseParam(tokens);
            case ".INCLUDE", ".INC", ".LIB" -> parseInclude(command, tokens);
            default -> log.debug("Ignoring directive {} at line {}", command, lineNumber);
        }
    }

    private void startSubckt(List<String> tokens, int lineNumber) {
        if (tokens.size() < 2) {
            throw new NetlistParseException("Invalid .SUBCKT definition: missing subcircuit name", Severity.ERROR);
        }

        Subckt subckt = Subckt.builder()
                .name(tokens.get(1))
                .sourceLine(lineNumber)
                .build();

        for (String token : tokens.subList(2, tokens.size())) {
            int eq = token.indexOf('=');
            if (eq >= 0) {
                subckt.getParameters().put(token.substring(0, eq), token.substring(eq + 1));
            } else if (!token.equalsIgnoreCase("PARAMS:")) {
                subckt.getPorts().add(token);
            }
        }

        circuit.addSubckt(subckt);
        scopeStack.push(currentScope);
        currentScope = subckt;

        log.debug("Parsed .SUBCKT {} with ports {} at line {}", subckt.getName(), subckt.getPorts(), lineNumber);
    }

    private void endSubckt() {
        if (!scopeStack.isEmpty()) {
            currentScope = scopeStack.pop();
        }
    }

    private void parseModel(List<String> tokens, int lineNumber) {
        if (tokens.size() < 3) {
            throw new NetlistParseException("Incomplete .MODEL statement: expected name and type");
        }

        List<String> paramTokens = new ArrayList<>(tokens.subList(3, tokens.size()));
        String type = tokens.get(2);
        int paren = type.indexOf('(');
        if (paren > 0) {
            // nmos(level=1 ...) with the parameter list glued to the type
            paramTokens.add(0, type.substring(paren + 1));
            type = type.substring(0, paren);
        }

        Model model = Model.builder()
                .name(tokens.get(1))
                .type(type)
                .sourceLine(lineNumber)
                .build();

        for (String token : paramTokens) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = stripParens(token.substring(0, eq));
            if (!key.isEmpty()) {
                model.getParameters().put(key, stripParens(token.substring(eq + 1)));
            }
        }

        circuit.addModel(model);
        log.debug("Parsed .MODEL {} ({}) at line {}", model.getName(), model.getType(), lineNumber);
    }

    private void parseParam(List<String> tokens) {
        for (String token : tokens.subList(1, tokens.size())) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String value = token.substring(eq + 1);
            if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                value = value.substring(1, value.length() - 1);
            }
            currentScope.getParameters().put(token.substring(0, eq), value);
        }
    }

    private void parseInclude(String command, List<String> tokens) {
        if (tokens.size() < 2) {
            throw new NetlistParseException(command + " without a path");
        }
        circuit.addInclude(String.join(" ", tokens.subList(1, tokens.size())));
    }

    // ---- Components ----

    private void parseComponent(List<String> tokens, int lineNumber) {
        String name = tokens.get(0);
        char kind = Character.toUpperCase(name.charAt(0));

        Component component = switch (kind) {
            case 'R', 'C', 'L' -> parsePassive(kind, tokens);
            case 'M' -> parseDevice(kind, tokens, 4);
            case 'Q' -> parseDevice(kind, tokens, 3); // 4-terminal BJTs are not distinguished
            case 'D' -> parseDevice(kind, tokens, 2);
            case 'V', 'I' -> parseSource(kind, tokens);
            case 'X' -> parseInstance(tokens);
            default -> throw new NetlistParseException("Unrecognised statement '" + name + "'");
        };

        component.setSourceLine(lineNumber);
        currentScope.addComponent(component);
        log.debug("Parsed {} {} at line {}", component.getKind().getTag(), component.getName(), lineNumber);
    }

    private Component parsePassive(char kind, List<String> tokens) {
        requireTokens(tokens, 3, "two nodes");
        String name = tokens.get(0);
        List<String> nodes = nodes(tokens, 1, 3);
        String value = tokens.size() > 3 ? tokens.get(3) : "0";

        Component component = switch (kind) {
            case 'R' -> Resistor.builder().name(name).nodes(nodes).value(value).build();
            case 'C' -> Capacitor.builder().name(name).nodes(nodes).value(value).build();
            default -> Inductor.builder().name(name).nodes(nodes).value(value).build();
        };
        applyTrailingTokens(component, tokens, 4);
        return component;
    }

    private Component parseDevice(char kind, List<String> tokens, int nodeCount) {
        requireTokens(tokens, nodeCount + 2, nodeCount + " nodes and a model name");
        String name = tokens.get(0);
        List<String> nodes = nodes(tokens, 1, nodeCount + 1);
        String model = tokens.get(nodeCount + 1);

        Component component = switch (kind) {
            case 'M' -> Mosfet.builder().name(name).nodes(nodes).model(model).build();
            case 'Q' -> Bjt.builder().name(name).nodes(nodes).model(model).build();
            default -> Diode.builder().name(name).nodes(nodes).model(model).build();
        };
        applyTrailingTokens(component, tokens, nodeCount + 2);
        return component;
    }

    private Component parseSource(char kind, List<String> tokens) {
        requireTokens(tokens, 3, "two nodes");
        String name = tokens.get(0);
        List<String> nodes = nodes(tokens, 1, 3);

        int next = 3;
        String dcValue = "0";
        if (tokens.size() > next && tokens.get(next).equalsIgnoreCase("DC") && tokens.size() > next + 1) {
            next++;
        }
        // "V1 in 0 AC 1" has no DC value
        if (tokens.size() > next && !tokens.get(next).equalsIgnoreCase("AC")) {
            dcValue = tokens.get(next++);
        }

        if (kind == 'I') {
            CurrentSource source = CurrentSource.builder().name(name).nodes(nodes).dcValue(dcValue).build();
            applyTrailingTokens(source, tokens, next);
            return source;
        }

        VoltageSource source = VoltageSource.builder().name(name).nodes(nodes).dcValue(dcValue).build();
        List<String> trailing = new ArrayList<>(tokens.subList(next, tokens.size()));
        int ac = indexOfIgnoreCase(trailing, "AC");
        if (ac >= 0 && ac + 1 < trailing.size() && trailing.get(ac + 1).indexOf('=') < 0) {
            source.setAcValue(trailing.get(ac + 1));
            trailing.subList(ac, ac + 2).clear();
        }
        applyTrailingTokens(source, trailing, 0);
        return source;
    }

    /**
     * X-lines come in two shapes:
     * - CDL:   Xname n1 n2 ... / subckt [key=value...]
     * - SPICE: Xname n1 n2 ... subckt [key=value...]
     * In the SPICE form the subcircuit name is the token just before the first key=value.
     */
    private Component parseInstance(List<String> tokens) {
        String name = tokens.get(0);
        List<String> nodes;
        String subcktName;
        int paramStart;

        int slash = tokens.indexOf("/");
        if (slash >= 0) {
            if (slash + 1 >= tokens.size()) {
                throw new NetlistParseException("Missing subcircuit name after '/'");
            }
            nodes = nodes(tokens, 1, slash);
            subcktName = tokens.get(slash + 1);
            paramStart = slash + 2;
        } else {
            int boundary = tokens.size();
            for (int i = 1; i < tokens.size(); i++) {
                if (tokens.get(i).indexOf('=') >= 0) {
                    boundary = i;
                    break;
                }
            }
            if (boundary < 2) {
                throw new NetlistParseException("Missing subcircuit name for instance '" + name + "'");
            }
            nodes = nodes(tokens, 1, boundary - 1);
            subcktName = tokens.get(boundary - 1);
            paramStart = boundary;
        }

        SubcktInstance instance = SubcktInstance.builder()
                .name(name)
                .nodes(nodes)
                .subcktName(subcktName)
                .build();
        applyTrailingTokens(instance, tokens, paramStart);
        return instance;
    }

    private void applyTrailingTokens(Component component, List<String> tokens, int from) {
        Map<String, String> parameters = component.getParameters();
        for (int i = from; i < tokens.size(); i++) {
            String token = tokens.get(i);
            int eq = token.indexOf('=');
            if (eq > 0) {
                parameters.put(token.substring(0, eq), token.substring(eq + 1));
            } else {
                component.getExtra().add(token);
            }
        }
    }

    // ---- Helpers ----

    private static void requireTokens(List<String> tokens, int count, String expected) {
        if (tokens.size() < count) {
            throw new NetlistParseException("Expected " + expected + " after '" + tokens.get(0) + "'");
        }
    }

    private static List<String> nodes(List<String> tokens, int from, int to) {
        return new ArrayList<>(tokens.subList(from, to));
    }

    private static int indexOfIgnoreCase(List<String> tokens, String needle) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).equalsIgnoreCase(needle)) {
                return i;
            }
        }
        return -1;
    }

    private static String stripParens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == '(' || value.charAt(start) == ')')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == '(' || value.charAt(end - 1) == ')')) {
            end--;
        }
        return value.substring(start, end);
    }

    private static String extractCircuitName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
