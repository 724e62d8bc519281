package com.spice.netlist.cli.validation;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import com.spice.netlist.analyzer.AnalyzerOptions;
import com.spice.netlist.cli.exception.OptionsValidationException;
import com.spice.netlist.cli.model.AnalyzeOptions;
import com.spice.netlist.cli.model.ValidatedAnalyzeOptions;

public class AnalyzeOptionsValidator {

    public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getNetlistFile() == null) {
            errors.add("Netlist file is required.");
        } else if (!Files.exists(o.getNetlistFile())) {
            errors.add("File '" + o.getNetlistFile() + "' not found.");
        } else if (!Files.isRegularFile(o.getNetlistFile())) {
            errors.add("Not a regular file: " + o.getNetlistFile());
        }

        if (o.getMaxDepth() <= 0) {
            errors.add("--max-depth must be > 0. Got: " + o.getMaxDepth());
        }

        if (o.getTopCell() != null && o.getTopCell().isBlank()) {
            errors.add("--top-cell must not be blank.");
        }

        if (o.getFindModel() != null && o.getFindModel().isBlank()) {
            errors.add("--find-model must not be blank.");
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(o.getNetlistFile(), errors);
        }

        AnalyzerOptions analyzerOptions = AnalyzerOptions.builder()
                .topCellName(o.getTopCell())
                .maxDepth(o.getMaxDepth())
                .build();

        boolean anyReport = o.isStats() || o.isFlatten() || o.isCountTransistors() || o.isModelUsage()
                || o.getFindModel() != null || o.isTree() || o.isListTopCells();

        return new ValidatedAnalyzeOptions(o.getNetlistFile(), analyzerOptions, anyReport);
    }
}
