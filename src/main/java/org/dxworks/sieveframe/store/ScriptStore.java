package org.dxworks.sieveframe.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Local persistence of script text.
 */
public interface ScriptStore {

    String load(Path path) throws IOException;

    void save(Path path, String text) throws IOException;
}
