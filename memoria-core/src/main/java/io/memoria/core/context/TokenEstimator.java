package io.memoria.core.context;

/**
 * Approximate token count of a text. Implementations must be deterministic and monotonic in
 * the text's length so that budget trimming always terminates.
 */
@FunctionalInterface
public interface TokenEstimator {
    int estimate(String text);
}
