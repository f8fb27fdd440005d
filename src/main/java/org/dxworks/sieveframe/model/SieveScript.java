package org.dxworks.sieveframe.model;

import java.util.ArrayList;
import java.util.List;

public class SieveScript {
    public String name = "";
    public List<SieveRule> rules = new ArrayList<>();
    public List<String> requires = new ArrayList<>(); // extensions in first-seen order
    public boolean active;

    public SieveScript() {
    }

    public SieveScript(String name) {
        this.name = name;
    }
}
