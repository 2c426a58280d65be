package com.lexicon.enrichment.pipeline;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observes the prompts a run sends to the oracle.
 */
@FunctionalInterface
public interface PromptTraceHook {

    PromptTraceHook NONE = (runId, prompt) -> { };

    void onPrompt(String runId, String prompt);

    /**
     * A hook that keeps the first prompt of the run.
     */
    static FirstPromptSample sampleFirst() {
        return new FirstPromptSample();
    }

    final class FirstPromptSample implements PromptTraceHook {
        private final AtomicReference<String> first = new AtomicReference<>();

        @Override
        public void onPrompt(String runId, String prompt) {
            first.compareAndSet(null, prompt);
        }

        public Optional<String> firstPrompt() {
            return Optional.ofNullable(first.get());
        }
    }
}
