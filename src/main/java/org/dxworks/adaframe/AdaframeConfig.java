package org.dxworks.adaframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.adaframe.ast.AnalysisContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AdaframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AdaframeConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "adaframe-config.yml";

    private final String charset;
    private final int tabStop;
    private final int maxFileLines;

    private AdaframeConfig(String charset, int tabStop, int maxFileLines) {
        this.charset = charset;
        this.tabStop = tabStop;
        this.maxFileLines = maxFileLines;
    }

    public String getCharset() {
        return charset;
    }

    public int getTabStop() {
        return tabStop;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static AdaframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static AdaframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String effectiveCharset = (yamlConfig.charset != null && Charset.isSupported(yamlConfig.charset))
                        ? yamlConfig.charset
                        : AnalysisContext.DEFAULT_CHARSET;
                int effectiveTabStop = (yamlConfig.tabStop != null && yamlConfig.tabStop > 0)
                        ? yamlConfig.tabStop
                        : AnalysisContext.DEFAULT_TAB_STOP;
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;

                return new AdaframeConfig(effectiveCharset, effectiveTabStop, effectiveMaxFileLines);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static AdaframeConfig with(String charset, int tabStop, int maxFileLines) {
        return new AdaframeConfig(
                charset != null ? charset : AnalysisContext.DEFAULT_CHARSET,
                tabStop > 0 ? tabStop : AnalysisContext.DEFAULT_TAB_STOP,
                maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES);
    }

    private static AdaframeConfig defaults() {
        return new AdaframeConfig(AnalysisContext.DEFAULT_CHARSET, AnalysisContext.DEFAULT_TAB_STOP, DEFAULT_MAX_FILE_LINES);
    }

    private static class YamlConfig {
        public String charset;
        public Integer tabStop;
        public Integer maxFileLines;
    }
}
