package com.yuubin.relay.core.boundary;

import java.io.IOException;

/**
 * Downstream consumer for task payloads handled by the dispatch loop.
 */
public interface PluginBoundary {

    /**
     * Delivers a task pushed by the plugin.
     * 
     * @param task The opaque task payload.
     * @throws IOException If the task cannot be delivered.
     */
    void onPushTask(byte[] task) throws IOException;

    /**
     * Delivers a task result received from the tunnel.
     * 
     * @param result The opaque result payload.
     * @throws IOException If the result cannot be delivered.
     */
    void onTaskResult(byte[] result) throws IOException;
}
