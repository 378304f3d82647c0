package com.rowguard.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of validating a plan node: passed, or failed with a reason.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Passed, ValidationOutcome.Failed {

    static ValidationOutcome passed() {
        return Passed.INSTANCE;
    }

    static ValidationOutcome failed(String reason) {
        return new Failed(reason);
    }

    default boolean isPassed() {
        return this instanceof Passed;
    }

    /**
     * Returns the failure reason.
     *
     * @return the reason, empty when passed
     */
    default Optional<String> reason() {
        return Optional.empty();
    }

    /**
     * The node may be offloaded as far as this check is concerned.
     */
    final class Passed implements ValidationOutcome {
        private static final Passed INSTANCE = new Passed();

        private Passed() {
        }

        @Override
        public String toString() {
            return "Passed";
        }
    }

    /**
     * The node must fall back.
     *
     * @param message the failure reason
     */
    record Failed(String message) implements ValidationOutcome {
        public Failed {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public Optional<String> reason() {
            return Optional.of(message);
        }
    }
}
