package io.parlance.core.verb;

/// Opaque cancellation signal carried from the caller of a run to verb actions.
///
/// The interpreter never inspects it. Long-running verbs may poll it and give up.
@FunctionalInterface
public interface CancellationToken {

    /// Token that is never cancelled.
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
