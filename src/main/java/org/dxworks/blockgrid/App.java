package org.dxworks.blockgrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.blockgrid.model.Structure;
import org.dxworks.blockgrid.model.result.GridSize;
import org.dxworks.blockgrid.model.result.ParseError;
import org.dxworks.blockgrid.model.result.RunResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) throws Exception {
        if (args.length != 2 && args.length != 4) {
            System.err.println("Usage: java -jar blockgrid.jar <structure-file> <output-file> [width height]");
            System.err.println("  <structure-file>: JSON file holding the line structure to evaluate");
            System.err.println("  <output-file>:    Path to output JSON file");
            System.err.println("  width height:     Grid size (defaults from blockgrid-config.yml, else 5x5)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        BlockgridConfig config = BlockgridConfig.load();
        GridSize gridSize;
        try {
            gridSize = args.length == 4
                    ? GridSize.of(Integer.parseInt(args[2]), Integer.parseInt(args[3]))
                    : GridSize.of(config.getGridWidth(), config.getGridHeight());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid grid size: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Starting evaluation...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Grid: " + gridSize);

        Instant startTime = Instant.now();
        RunResult result;
        try {
            result = evaluateFile(input, gridSize, config);
        } catch (IOException e) {
            System.err.println("Error: Could not read structure from " + input + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writer.write(MAPPER.writeValueAsString(result));
            writer.newLine();
        }
        Duration duration = Duration.between(startTime, Instant.now());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Evaluation complete in " + duration.toMillis() + " ms");
        if (result.hasParseErrors()) {
            System.out.println("Parse errors: " + result.parseErrors.size() + " (grid not evaluated)");
            for (ParseError error : result.parseErrors) {
                System.out.println("  - " + error);
            }
        } else if (!result.runtimeErrors.isEmpty()) {
            System.out.println("Cells with runtime errors: " + result.runtimeErrors.size() + "/" + gridSize.cellCount());
        } else {
            System.out.println("All " + gridSize.cellCount() + " cells evaluated");
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    public static Structure readStructure(Path filePath) throws IOException {
        String json = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (json.startsWith("\uFEFF")) {
            json = json.substring(1);
        }

        Structure structure = MAPPER.readValue(json, Structure.class);
        if (structure == null) {
            throw new IOException("Empty structure document: " + filePath);
        }
        return structure;
    }

    public static RunResult evaluateFile(Path filePath, GridSize gridSize, BlockgridConfig config) throws IOException {
        Structure structure = readStructure(filePath);
        return new EvaluationService(config).run(structure, gridSize);
    }
}
