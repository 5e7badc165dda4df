package org.dxworks.syntaxview;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SyntaxViewConfig {

    private static final String CONFIG_FILE_NAME = "syntaxview-config.yml";

    private static final int DEFAULT_MAX_DEPTH = 2000;
    private static final int DEFAULT_NODE_PROPERTY_MAX_LENGTH = 50;
    private static final int DEFAULT_TOKEN_PROPERTY_MAX_LENGTH = 100;
    private static final int DEFAULT_TO_STRING_MAX_LENGTH = 50;
    private static final int DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH = 30;
    private static final int DEFAULT_TRIVIA_PREVIEW_COUNT = 3;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;

    private final int maxDepth;
    private final int nodePropertyMaxLength;
    private final int tokenPropertyMaxLength;
    private final int toStringMaxLength;
    private final int triviaPreviewMaxLength;
    private final int triviaPreviewCount;
    private final int maxFileLines;

    private SyntaxViewConfig(int maxDepth, int nodePropertyMaxLength, int tokenPropertyMaxLength,
                             int toStringMaxLength, int triviaPreviewMaxLength, int triviaPreviewCount,
                             int maxFileLines) {
        this.maxDepth = maxDepth;
        this.nodePropertyMaxLength = nodePropertyMaxLength;
        this.tokenPropertyMaxLength = tokenPropertyMaxLength;
        this.toStringMaxLength = toStringMaxLength;
        this.triviaPreviewMaxLength = triviaPreviewMaxLength;
        this.triviaPreviewCount = triviaPreviewCount;
        this.maxFileLines = maxFileLines;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getNodePropertyMaxLength() {
        return nodePropertyMaxLength;
    }

    public int getTokenPropertyMaxLength() {
        return tokenPropertyMaxLength;
    }

    public int getToStringMaxLength() {
        return toStringMaxLength;
    }

    public int getTriviaPreviewMaxLength() {
        return triviaPreviewMaxLength;
    }

    public int getTriviaPreviewCount() {
        return triviaPreviewCount;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static SyntaxViewConfig defaults() {
        return new SyntaxViewConfig(DEFAULT_MAX_DEPTH, DEFAULT_NODE_PROPERTY_MAX_LENGTH,
                DEFAULT_TOKEN_PROPERTY_MAX_LENGTH, DEFAULT_TO_STRING_MAX_LENGTH,
                DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH, DEFAULT_TRIVIA_PREVIEW_COUNT, DEFAULT_MAX_FILE_LINES);
    }

    public static SyntaxViewConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static SyntaxViewConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new SyntaxViewConfig(
                        positiveOr(yamlConfig.maxDepth, DEFAULT_MAX_DEPTH),
                        positiveOr(yamlConfig.nodePropertyMaxLength, DEFAULT_NODE_PROPERTY_MAX_LENGTH),
                        positiveOr(yamlConfig.tokenPropertyMaxLength, DEFAULT_TOKEN_PROPERTY_MAX_LENGTH),
                        positiveOr(yamlConfig.toStringMaxLength, DEFAULT_TO_STRING_MAX_LENGTH),
                        positiveOr(yamlConfig.triviaPreviewMaxLength, DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH),
                        positiveOr(yamlConfig.triviaPreviewCount, DEFAULT_TRIVIA_PREVIEW_COUNT),
                        positiveOr(yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES));
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static SyntaxViewConfig with(int maxDepth, int nodePropertyMaxLength, int tokenPropertyMaxLength,
                                        int toStringMaxLength) {
        return new SyntaxViewConfig(
                positiveOr(maxDepth, DEFAULT_MAX_DEPTH),
                positiveOr(nodePropertyMaxLength, DEFAULT_NODE_PROPERTY_MAX_LENGTH),
                positiveOr(tokenPropertyMaxLength, DEFAULT_TOKEN_PROPERTY_MAX_LENGTH),
                positiveOr(toStringMaxLength, DEFAULT_TO_STRING_MAX_LENGTH),
                DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH, DEFAULT_TRIVIA_PREVIEW_COUNT, DEFAULT_MAX_FILE_LINES);
    }

    private static int positiveOr(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    private static class YamlConfig {
        public Integer maxDepth;
        public Integer nodePropertyMaxLength;
        public Integer tokenPropertyMaxLength;
        public Integer toStringMaxLength;
        public Integer triviaPreviewMaxLength;
        public Integer triviaPreviewCount;
        public Integer maxFileLines;
    }
}
