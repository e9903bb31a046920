package com.autorestart.plugin.host;

/**
 * The chat request an administrator command arrived with. Permission checks
 * have already been done by the host's command router.
 */
public interface RequestContext {

    /** Platform the request arrived on. */
    String getPlatformId();

    /** Origin session to route replies and the completion notice to. */
    String getSession();

    void reply(String text);
}
