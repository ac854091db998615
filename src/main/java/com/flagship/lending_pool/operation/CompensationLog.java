package com.flagship.lending_pool.operation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo steps recorded while an operation runs.
 *
 * Every ledger write and every completed transfer registers how to reverse
 * it. If the operation fails, {@link #rollback} runs the steps newest first,
 * so either the whole operation applies or none of it does.
 */
@Slf4j
class CompensationLog {

    private final Deque<Step> steps = new ArrayDeque<>();

    void record(String description, Runnable undo) {
        steps.push(new Step(description, undo));
    }

    int size() {
        return steps.size();
    }

    /**
     * Reverses every recorded step. A step that fails is attached to
     * {@code cause} as suppressed and the remaining steps still run.
     */
    void rollback(Throwable cause) {
        if (!steps.isEmpty()) {
            log.warn("Rolling back {} step(s) after failure: {}", steps.size(), cause.getMessage());
        }
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.undo.run();
            } catch (RuntimeException e) {
                log.error("Compensation step failed: {}", step.description, e);
                cause.addSuppressed(e);
            }
        }
    }

    private static final class Step {
        private final String description;
        private final Runnable undo;

        private Step(String description, Runnable undo) {
            this.description = description;
            this.undo = undo;
        }
    }
}
