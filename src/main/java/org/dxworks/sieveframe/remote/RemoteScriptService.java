package org.dxworks.sieveframe.remote;

import org.dxworks.sieveframe.converter.SieveScriptConverter;
import org.dxworks.sieveframe.model.SieveScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Moves scripts between a ManageSieve server and the rule model.
 */
public class RemoteScriptService {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteScriptService.class);

    private final ManageSieveClient client;
    private final SieveScriptConverter converter;

    public RemoteScriptService(ManageSieveClient client, SieveScriptConverter converter) {
        this.client = client;
        this.converter = converter;
    }

    public List<ScriptInfo> list() throws IOException {
        return client.listScripts();
    }

    public SieveScript download(String name) throws IOException {
        String text = client.getScript(name);
        SieveScript script = converter.textToScript(text, name);
        script.active = isActive(name);
        LOG.debug("Downloaded script '{}' with {} rules", name, script.rules.size());
        return script;
    }

    /**
     * Emits {@code script}, has the server check it, then stores it and activates it when
     * {@link SieveScript#active} is set.
     *
     * @return the text that was stored
     */
    public String upload(SieveScript script) throws IOException, ScriptRejectedException {
        String text = converter.scriptToText(script);
        if (!client.checkScript(text)) {
            throw new ScriptRejectedException(script.name);
        }
        client.putScript(script.name, text);
        if (script.active) {
            client.setActive(script.name);
        }
        LOG.debug("Uploaded script '{}' ({} chars, active={})", script.name, text.length(), script.active);
        return text;
    }

    public void delete(String name) throws IOException {
        client.deleteScript(name);
    }

    private boolean isActive(String name) throws IOException {
        for (ScriptInfo info : client.listScripts()) {
            if (info.name.equals(name)) {
                return info.active;
            }
        }
        return false;
    }
}
