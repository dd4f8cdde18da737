package io.parlance.core;

/// Lifetime of the variable table used by {@link ParlanceEngine#run(String)}.
public enum VariableScope {
    /// Each run gets a fresh table seeded with the engine's registered variables.
    PER_RUN,
    /// All runs share one table; results stored by one run are visible to the next.
    SESSION
}
