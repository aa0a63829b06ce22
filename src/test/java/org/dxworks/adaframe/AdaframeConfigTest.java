package org.dxworks.adaframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AdaframeConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileYieldsDefaults() {
        AdaframeConfig config = AdaframeConfig.load(dir.resolve("adaframe-config.yml"));
        assertEquals("UTF-8", config.getCharset());
        assertEquals(8, config.getTabStop());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void readsAllSettings() throws IOException {
        Path file = write("charset: ISO-8859-1\ntabStop: 4\nmaxFileLines: 500\n");
        AdaframeConfig config = AdaframeConfig.load(file);
        assertEquals("ISO-8859-1", config.getCharset());
        assertEquals(4, config.getTabStop());
        assertEquals(500, config.getMaxFileLines());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = write("charset: no-such-charset\ntabStop: 0\nmaxFileLines: -3\n");
        AdaframeConfig config = AdaframeConfig.load(file);
        assertEquals("UTF-8", config.getCharset());
        assertEquals(8, config.getTabStop());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void malformedYamlYieldsDefaults() throws IOException {
        Path file = write("tabStop: [unterminated\n");
        AdaframeConfig config = AdaframeConfig.load(file);
        assertEquals(8, config.getTabStop());
    }

    private Path write(String content) throws IOException {
        Path file = dir.resolve("adaframe-config.yml");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
