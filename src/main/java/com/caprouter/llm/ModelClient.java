package com.caprouter.llm;

import com.caprouter.models.ChatMessage;

import java.io.IOException;
import java.util.List;

/**
 * Text-generation model behind the router.
 * Implementations own their network timeout and retry policy.
 */
public interface ModelClient {

    /**
     * Generate the next assistant reply.
     *
     * @param messages conversation turns, oldest first (system prompt excluded)
     * @param systemPrompt the system prompt to prepend
     * @return the raw reply text, possibly malformed
     */
    String generate(List<ChatMessage> messages, String systemPrompt)
        throws IOException, InterruptedException;
}
