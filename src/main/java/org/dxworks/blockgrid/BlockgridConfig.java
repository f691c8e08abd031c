package org.dxworks.blockgrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class BlockgridConfig {

    private static final String CONFIG_FILE_NAME = "blockgrid-config.yml";
    private static final int DEFAULT_GRID_WIDTH = 5;
    private static final int DEFAULT_GRID_HEIGHT = 5;
    private static final String DEFAULT_UNSET_COLOR = "";
    private static final String DEFAULT_ERROR_COLOR = "";
    private static final String DEFAULT_PARSE_FAILURE_COLOR = "gray";
    private static final boolean DEFAULT_PARALLEL_EVALUATION = false;

    private final int gridWidth;
    private final int gridHeight;
    private final String unsetColor;
    private final String errorColor;
    private final String parseFailureColor;
    private final boolean parallelEvaluation;

    private BlockgridConfig(int gridWidth, int gridHeight, String unsetColor, String errorColor,
                            String parseFailureColor, boolean parallelEvaluation) {
        this.gridWidth = gridWidth;
        this.gridHeight = gridHeight;
        this.unsetColor = unsetColor;
        this.errorColor = errorColor;
        this.parseFailureColor = parseFailureColor;
        this.parallelEvaluation = parallelEvaluation;
    }

    public int getGridWidth() {
        return gridWidth;
    }

    public int getGridHeight() {
        return gridHeight;
    }

    public String getUnsetColor() {
        return unsetColor;
    }

    public String getErrorColor() {
        return errorColor;
    }

    public String getParseFailureColor() {
        return parseFailureColor;
    }

    public boolean isParallelEvaluation() {
        return parallelEvaluation;
    }

    public static BlockgridConfig defaults() {
        return new BlockgridConfig(DEFAULT_GRID_WIDTH, DEFAULT_GRID_HEIGHT, DEFAULT_UNSET_COLOR,
                DEFAULT_ERROR_COLOR, DEFAULT_PARSE_FAILURE_COLOR, DEFAULT_PARALLEL_EVALUATION);
    }

    public static BlockgridConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static BlockgridConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveWidth = (yamlConfig.gridWidth != null && yamlConfig.gridWidth > 0)
                        ? yamlConfig.gridWidth
                        : DEFAULT_GRID_WIDTH;
                int effectiveHeight = (yamlConfig.gridHeight != null && yamlConfig.gridHeight > 0)
                        ? yamlConfig.gridHeight
                        : DEFAULT_GRID_HEIGHT;
                String effectiveUnsetColor = yamlConfig.unsetColor != null
                        ? yamlConfig.unsetColor
                        : DEFAULT_UNSET_COLOR;
                String effectiveErrorColor = yamlConfig.errorColor != null
                        ? yamlConfig.errorColor
                        : DEFAULT_ERROR_COLOR;
                String effectiveParseFailureColor = yamlConfig.parseFailureColor != null
                        ? yamlConfig.parseFailureColor
                        : DEFAULT_PARSE_FAILURE_COLOR;
                boolean effectiveParallel = yamlConfig.parallelEvaluation != null
                        ? yamlConfig.parallelEvaluation
                        : DEFAULT_PARALLEL_EVALUATION;

                return new BlockgridConfig(effectiveWidth, effectiveHeight, effectiveUnsetColor,
                        effectiveErrorColor, effectiveParseFailureColor, effectiveParallel);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static BlockgridConfig with(int gridWidth, int gridHeight, String unsetColor, String errorColor,
                                       String parseFailureColor, boolean parallelEvaluation) {
        int effectiveWidth = gridWidth > 0 ? gridWidth : DEFAULT_GRID_WIDTH;
        int effectiveHeight = gridHeight > 0 ? gridHeight : DEFAULT_GRID_HEIGHT;
        return new BlockgridConfig(effectiveWidth, effectiveHeight,
                unsetColor != null ? unsetColor : DEFAULT_UNSET_COLOR,
                errorColor != null ? errorColor : DEFAULT_ERROR_COLOR,
                parseFailureColor != null ? parseFailureColor : DEFAULT_PARSE_FAILURE_COLOR,
                parallelEvaluation);
    }

    private static class YamlConfig {
        public Integer gridWidth;
        public Integer gridHeight;
        public String unsetColor;
        public String errorColor;
        public String parseFailureColor;
        public Boolean parallelEvaluation;
    }
}
