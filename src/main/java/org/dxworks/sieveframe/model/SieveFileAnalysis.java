package org.dxworks.sieveframe.model;

/**
 * One line of the {@code analyze} output: a script file and the rules read from it.
 */
public class SieveFileAnalysis {
    public String kind = "script";
    public String filePath;
    public String language = "sieve";
    public SieveScript script;
}
