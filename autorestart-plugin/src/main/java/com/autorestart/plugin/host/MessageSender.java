package com.autorestart.plugin.host;

/**
 * Delivers a text message to a chat session on the host platform.
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * @param session opaque origin identifier recorded when the restart was requested
     * @param text    plain message text
     */
    void send(String session, String text);
}
