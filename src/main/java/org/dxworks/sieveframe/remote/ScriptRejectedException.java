package org.dxworks.sieveframe.remote;

/**
 * The server refused a script during {@code CHECKSCRIPT}; nothing was stored.
 */
public class ScriptRejectedException extends Exception {

    private final String scriptName;

    public ScriptRejectedException(String scriptName) {
        super("Server rejected script '" + scriptName + "'");
        this.scriptName = scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }
}
