package io.parlance.core;

import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.verb.VerbRegistry;
import io.parlance.core.verb.VerbServices;
import java.util.concurrent.ExecutorService;

/// Container holding the wired interpreter components.
///
/// Implements {@link AutoCloseable} to release the thread pool behind the
/// shared HTTP client.
///
/// ### Contracts
/// - **Postcondition**: all getters return the same instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link ParlanceFactory#createEnvironment()} or
/// {@link ParlanceFactory.Builder} rather than direct construction.
///
/// @see ParlanceFactory
public final class ParlanceEnvironment implements AutoCloseable {

    private final ParlanceEngine engine;
    private final VerbRegistry verbRegistry;
    private final Lexicon lexicon;
    private final VerbServices verbServices;
    private final ParlanceConfig config;
    private final ExecutorService httpExecutor;

    /// Creates a new environment with the specified components.
    ///
    /// @param engine command engine, not null
    /// @param verbRegistry registry of verb implementations, not null
    /// @param lexicon usage cache over the registry, not null
    /// @param verbServices services handed to verbs, not null
    /// @param config configuration the environment was built from, not null
    /// @param httpExecutor thread pool behind the HTTP client, not null
    public ParlanceEnvironment(
            ParlanceEngine engine,
            VerbRegistry verbRegistry,
            Lexicon lexicon,
            VerbServices verbServices,
            ParlanceConfig config,
            ExecutorService httpExecutor) {
        this.engine = engine;
        this.verbRegistry = verbRegistry;
        this.lexicon = lexicon;
        this.verbServices = verbServices;
        this.config = config;
        this.httpExecutor = httpExecutor;
    }

    /// Returns the engine that runs commands.
    ///
    /// @return the engine, never null
    public ParlanceEngine getEngine() {
        return engine;
    }

    /// Returns the registry of verb implementations.
    ///
    /// @return the registry, never null
    public VerbRegistry getVerbRegistry() {
        return verbRegistry;
    }

    public Lexicon getLexicon() {
        return lexicon;
    }

    public VerbServices getVerbServices() {
        return verbServices;
    }

    public ParlanceConfig getConfig() {
        return config;
    }

    /// Shuts down the HTTP thread pool.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block.
    @Override
    public void close() {
        httpExecutor.shutdown();
    }
}
