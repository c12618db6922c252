package com.naturalsql.compiler;

import java.util.concurrent.CompletableFuture;

/**
 * Text generation capability used to compile requests. Output format is not guaranteed.
 */
public interface LanguageModel {

    /**
     * Whether the model is configured and may be called.
     *
     * @return enabled
     */
    boolean isEnabled();

    /**
     * Start generating a reply. Cancelling the returned future aborts the call.
     *
     * @param prompt prompt
     * @return future reply text
     */
    CompletableFuture<String> generate(Prompt prompt);
}
