package io.parlance.core.verb;

/// A bundle of verb implementations registered together at startup.
///
/// {@snippet :
/// public final class MyVerbs implements VerbModule {
///     public void register(VerbRegistry registry) {
///         registry.register(CountWords::new);
///     }
/// }
/// }
///
/// @see io.parlance.core.ParlanceFactory.Builder#verbModule(VerbModule)
public interface VerbModule {

    /// Registers this module's verb factories.
    ///
    /// @param registry target registry, not null
    void register(VerbRegistry registry);
}
