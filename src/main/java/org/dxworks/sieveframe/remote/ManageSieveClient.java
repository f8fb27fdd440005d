package org.dxworks.sieveframe.remote;

import org.dxworks.sieveframe.model.ConnectionProfile;

import java.io.IOException;
import java.util.List;

/**
 * A session with a ManageSieve (RFC 5804) server.
 * <p>
 * Every call other than {@link #connect} and {@link #isConnected} fails with an
 * {@link IOException} when no session is open or the server answers {@code NO}/{@code BYE}.
 */
public interface ManageSieveClient {

    void connect(ConnectionProfile profile, String password) throws IOException;

    void disconnect() throws IOException;

    boolean isConnected();

    List<ScriptInfo> listScripts() throws IOException;

    String getScript(String name) throws IOException;

    void putScript(String name, String content) throws IOException;

    void setActive(String name) throws IOException;

    void deleteScript(String name) throws IOException;

    /** @return whether the server accepts {@code content} as a valid script */
    boolean checkScript(String content) throws IOException;
}
