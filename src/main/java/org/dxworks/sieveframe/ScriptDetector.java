package org.dxworks.sieveframe;

import java.nio.file.Path;
import java.util.Locale;

public class ScriptDetector {

    private final SieveframeConfig config;

    public ScriptDetector(SieveframeConfig config) {
        this.config = config;
    }

    public boolean isScript(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : config.getScriptExtensions()) {
            if (fileName.endsWith(extension.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /** File name without the script extension, used as the script name. */
    public String scriptName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : config.getScriptExtensions()) {
            if (lower.endsWith(extension.toLowerCase(Locale.ROOT))) {
                return fileName.substring(0, fileName.length() - extension.length());
            }
        }
        return fileName;
    }
}
