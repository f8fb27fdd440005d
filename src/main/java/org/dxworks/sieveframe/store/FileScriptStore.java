package org.dxworks.sieveframe.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes scripts as UTF-8 files. A leading byte order mark is dropped on load.
 */
public class FileScriptStore implements ScriptStore {

    private static final String BOM = "\uFEFF";

    @Override
    public String load(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (text.startsWith(BOM)) {
            text = text.substring(1);
        }
        return text;
    }

    @Override
    public void save(Path path, String text) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }
}
