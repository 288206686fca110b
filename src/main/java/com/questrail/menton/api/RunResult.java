package com.questrail.menton.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single Menton run.
 *
 * <p>A run either decodes completely or fails; there is no partial output. A
 * {@link Failed} result never carries any text produced before the failure.</p>
 */
public sealed interface RunResult permits RunResult.Decoded, RunResult.Failed
{
    /**
     * Returns {@code true} if the run produced output.
     */
    boolean isDecoded();

    /**
     * Returns the decoded output, or empty for a failed run.
     */
    Optional<String> output();

    /**
     * Returns the failure, or empty for a decoded run.
     */
    Optional<MentonException> error();

    record Decoded(String text) implements RunResult
    {
        public Decoded {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean isDecoded() {
            return true;
        }

        @Override
        public Optional<String> output() {
            return Optional.of(text);
        }

        @Override
        public Optional<MentonException> error() {
            return Optional.empty();
        }
    }

    record Failed(MentonException cause) implements RunResult
    {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isDecoded() {
            return false;
        }

        @Override
        public Optional<String> output() {
            return Optional.empty();
        }

        @Override
        public Optional<MentonException> error() {
            return Optional.of(cause);
        }
    }
}
