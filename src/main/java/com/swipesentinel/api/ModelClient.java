package com.swipesentinel.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Sends one chat-completions request body and returns the reply.
 *
 * Implementations never throw for API-level failures; they return
 * {@link ModelReply#error}.
 */
public interface ModelClient {
    ModelReply complete(ObjectNode requestBody);
}
