package com.spice.netlist.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.diagnostics.NetlistDiagnostics;
import com.spice.netlist.diagnostics.ParseDiagnostic;
import com.spice.netlist.diagnostics.Severity;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Model;
import com.spice.netlist.model.Subckt;

/**
 * Loads a netlist and pulls in the definitions of every .INCLUDE/.LIB target it references.
 *
 * Only subcircuits, models and parameters of included files are merged into the top circuit;
 * their top-level components are not. A name the top circuit already defines is never replaced. Relative paths resolve against the including file.
 * The include list of the top circuit keeps its verbatim entries.
 *
 * Diagnostics are written to NetlistDiagnostics; a missing or cyclic include never aborts loading.
 */
public class IncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

    /** Tracks the include chain being loaded to detect cycles. */
    private final Set<Path> currentlyResolving = new HashSet<>();

    public Circuit load(Path file, NetlistDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(diagnostics, "diagnostics");

        Circuit circuit = new SpiceParser().parseFile(file, diagnostics);

        Path key = normalize(file);
        currentlyResolving.add(key);
        try {
            resolveIncludes(circuit, circuit, file, diagnostics);
        } finally {
            currentlyResolving.remove(key);
        }
        return circuit;
    }

    private void resolveIncludes(Circuit target, Circuit source, Path sourcePath, NetlistDiagnostics diagnostics) {
        for (String include : source.getIncludes()) {
            String rawPath = extractPath(include);

            if (rawPath.isBlank()) {
                diagnostics.add(diagnostic(Severity.WARNING, sourcePath, "Include with blank path: " + include));
                continue;
            }

            Path resolved;
            try {
                resolved = resolve(sourcePath, rawPath);
            } catch (InvalidPathException e) {
                diagnostics.add(diagnostic(Severity.ERROR, sourcePath, "Invalid include path '" + rawPath + "'"));
                continue;
            }

            if (!Files.isRegularFile(resolved)) {
                String msg = String.format("Missing include '%s' referenced from %s", rawPath, sourcePath);
                diagnostics.add(diagnostic(Severity.ERROR, sourcePath, msg));
                log.error(msg);
                continue;
            }

            Path key = normalize(resolved);
            if (currentlyResolving.contains(key)) {
                String msg = "Cyclic include detected: " + rawPath + " referenced from " + sourcePath;
                diagnostics.add(diagnostic(Severity.ERROR, sourcePath, msg));
                log.error(msg);
                continue;
            }

            currentlyResolving.add(key);
            try {
                Circuit included = new SpiceParser().parseFile(resolved, diagnostics);
                resolveIncludes(target, included, resolved, diagnostics);
                merge(target, included, resolved);
                log.info("Resolved include {} -> {}", rawPath, resolved);
            } catch (IOException e) {
                String msg = "Failed to read include " + rawPath + " referenced from " + sourcePath
                        + " (" + e.getMessage() + ")";
                diagnostics.add(diagnostic(Severity.ERROR, sourcePath, msg));
                log.error("Failed to read include {}", rawPath, e);
            } finally {
                currentlyResolving.remove(key);
            }
        }
    }

    /**
     * Definitions already present in the target win over included ones of the same name.
     */
    private void merge(Circuit target, Circuit included, Path includedPath) {
        for (Subckt subckt : included.getSubcircuits()) {
            if (target.findSubckt(subckt.getName()).isPresent()) {
                log.warn("Subcircuit '{}' from {} is already defined; keeping the existing definition",
                        subckt.getName(), includedPath);
                continue;
            }
            target.addSubckt(subckt);
        }
        for (Model model : included.getModels()) {
            if (target.findModel(model.getName()).isPresent()) {
                log.warn("Model '{}' from {} is already defined; keeping the existing definition",
                        model.getName(), includedPath);
                continue;
            }
            target.addModel(model);
        }
        included.getParameters().forEach(target.getParameters()::putIfAbsent);
    }

    /**
     * First token of the recorded include, without quotes. A .LIB section name after the path is ignored.
     */
    static String extractPath(String include) {
        List<String> tokens = new SpiceTokenizer(include).tokenize();
        if (tokens.isEmpty()) {
            return "";
        }
        String path = tokens.get(0);
        if (path.length() >= 2) {
            char first = path.charAt(0);
            char last = path.charAt(path.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                path = path.substring(1, path.length() - 1);
            }
        }
        return path.strip();
    }

    private static Path resolve(Path sourcePath, String rawPath) {
        Path path = Path.of(rawPath);
        if (path.isAbsolute()) {
            return path;
        }
        Path parent = sourcePath.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(path) : path;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static ParseDiagnostic diagnostic(Severity severity, Path sourcePath, String message) {
        return ParseDiagnostic.builder()
                .severity(severity)
                .sourceFile(sourcePath.toString())
                .message(message)
                .build();
    }
}
