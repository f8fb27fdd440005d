package org.dxworks.sieveframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class SieveframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SieveframeConfig.class);

    private static final int DEFAULT_MAX_SCRIPT_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "sieveframe-config.yml";
    private static final List<String> DEFAULT_SCRIPT_EXTENSIONS = List.of(".sieve", ".siv");
    private static final boolean DEFAULT_PRETTY_PRINT = false;

    private final int maxScriptLines;
    private final List<String> scriptExtensions;
    private final boolean prettyPrint;

    private SieveframeConfig(int maxScriptLines, List<String> scriptExtensions, boolean prettyPrint) {
        this.maxScriptLines = maxScriptLines;
        this.scriptExtensions = List.copyOf(scriptExtensions);
        this.prettyPrint = prettyPrint;
    }

    public int getMaxScriptLines() {
        return maxScriptLines;
    }

    public List<String> getScriptExtensions() {
        return scriptExtensions;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public static SieveframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static SieveframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxScriptLines = yamlConfig.maxScriptLines;
                List<String> scriptExtensions = yamlConfig.scriptExtensions;
                Boolean prettyPrint = yamlConfig.prettyPrint;

                int effectiveMaxScriptLines = (maxScriptLines != null && maxScriptLines > 0)
                        ? maxScriptLines
                        : DEFAULT_MAX_SCRIPT_LINES;
                List<String> effectiveExtensions = (scriptExtensions != null && !scriptExtensions.isEmpty())
                        ? scriptExtensions
                        : DEFAULT_SCRIPT_EXTENSIONS;
                boolean effectivePrettyPrint = (prettyPrint != null)
                        ? prettyPrint
                        : DEFAULT_PRETTY_PRINT;

                return new SieveframeConfig(effectiveMaxScriptLines, effectiveExtensions, effectivePrettyPrint);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static SieveframeConfig defaults() {
        return new SieveframeConfig(DEFAULT_MAX_SCRIPT_LINES, DEFAULT_SCRIPT_EXTENSIONS, DEFAULT_PRETTY_PRINT);
    }

    public static SieveframeConfig with(int maxScriptLines, List<String> scriptExtensions, boolean prettyPrint) {
        int effectiveMaxScriptLines = maxScriptLines > 0 ? maxScriptLines : DEFAULT_MAX_SCRIPT_LINES;
        List<String> effectiveExtensions = (scriptExtensions != null && !scriptExtensions.isEmpty())
                ? scriptExtensions
                : DEFAULT_SCRIPT_EXTENSIONS;
        return new SieveframeConfig(effectiveMaxScriptLines, effectiveExtensions, prettyPrint);
    }

    private static class YamlConfig {
        public Integer maxScriptLines;
        public List<String> scriptExtensions;
        public Boolean prettyPrint;
    }
}
