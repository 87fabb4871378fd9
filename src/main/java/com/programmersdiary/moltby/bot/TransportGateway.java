package com.programmersdiary.moltby.bot;

/**
 * Outbound channel used to deliver scheduled messages.
 */
public interface TransportGateway {

    boolean isAttached();

    void sendMessage(String target, String text) throws TransportException;
}
