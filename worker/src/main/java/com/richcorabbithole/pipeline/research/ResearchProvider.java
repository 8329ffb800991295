package com.richcorabbithole.pipeline.research;

/**
 * Synchronous content-generation call used by the research worker.
 * Implementations do not retry; retry belongs to the work queue.
 */
public interface ResearchProvider {

    /**
     * @throws ResearchProviderException on transport, authentication, rate limit or
     *                                   protocol failures
     */
    ResearchResponse createMessage(String apiKey, String systemPrompt, String userMessage);
}
