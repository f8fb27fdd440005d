package org.dxworks.sieveframe.remote;

/**
 * A script as listed by the server.
 */
public class ScriptInfo {
    public String name = "";
    public boolean active;

    public ScriptInfo() {
    }

    public ScriptInfo(String name, boolean active) {
        this.name = name;
        this.active = active;
    }
}
