package com.measure.compiler.extraction;

import java.util.List;

/**
 * Single-shot text completion capability used by the extraction passes.
 * Implementations wrap a concrete model provider; failures are reported as {@link OracleException}.
 */
public interface OracleClient {

    /**
     * @param systemPrompt Instructions for the pass
     * @param messages Conversation turns, usually a single user message carrying the document
     * @param maxTokens Upper bound on the completion length
     * @return The raw completion text
     */
    String complete(String systemPrompt, List<OracleMessage> messages, int maxTokens);
}
