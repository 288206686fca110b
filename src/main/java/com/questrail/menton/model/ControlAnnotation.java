package com.questrail.menton.model;

import java.util.Objects;

/**
 * Annotation recorded when a control marker closes an utterance.
 *
 * <p>The only variant today is {@link Inert}: the marker is validated for
 * placement and otherwise has no effect. New behaviour is added as a new
 * variant, leaving the parser untouched.</p>
 */
public sealed interface ControlAnnotation permits ControlAnnotation.Inert
{
    int lineNumber();

    record Inert(int lineNumber, String marker) implements ControlAnnotation
    {
        public Inert {
            Objects.requireNonNull(marker, "marker");
        }
    }
}
