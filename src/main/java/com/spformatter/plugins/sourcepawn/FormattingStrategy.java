package com.spformatter.plugins.sourcepawn;

import java.util.Optional;

/**
 * One step of the formatting chain. A strategy either produces the formatted text or
 * gives up by returning empty, after which the next strategy runs.
 */
public interface FormattingStrategy {

    /**
     * Whether the strategy applies to the request at all.
     */
    boolean accepts(FormattingRequest request);

    /**
     * Attempts to format. Implementations catch their own failures.
     */
    Optional<String> apply(FormattingRequest request);

    FormatOutcome.Strategy kind();
}
