package org.dxworks.sieveframe.model;

/**
 * Where a ManageSieve server lives and who to log in as. The password is never stored here.
 */
public class ConnectionProfile {
    public static final int DEFAULT_PORT = 4190;

    public String name = "";
    public String host = "";
    public int port = DEFAULT_PORT;
    public String username = "";
    public boolean useStarttls = true;
}
