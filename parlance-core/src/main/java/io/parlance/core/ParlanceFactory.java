package io.parlance.core;

import io.parlance.core.dispatch.Dispatcher;
import io.parlance.core.execution.pipeline.ExecutionPipeline;
import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.match.TokenMatcher;
import io.parlance.core.sentence.SentenceExecutor;
import io.parlance.core.sentence.SentenceFactory;
import io.parlance.core.token.Tokenizer;
import io.parlance.core.validation.SentenceValidator;
import io.parlance.core.variable.MapStructuredValueReader;
import io.parlance.core.variable.StructuredValueReader;
import io.parlance.core.variable.VariableTable;
import io.parlance.core.verb.DefaultVerbRegistry;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbModule;
import io.parlance.core.verb.VerbRegistry;
import io.parlance.core.verb.VerbServices;
import io.parlance.core.verb.builtin.BuiltinVerbs;
import io.parlance.core.word.WordFactory;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Factory for creating and wiring Parlance interpreter environments.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully-configured {@link ParlanceEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with extra verb modules** (how the CLI wires JSON support):
/// {@snippet :
/// var env = ParlanceFactory.builder()
///     .config(ParlanceConfig.builder().variableScope(VariableScope.SESSION).build())
///     .verbModule(new JsonVerbs())
///     .structuredValueReader(new JacksonStructuredValueReader(mapper))
///     .build();
/// }
///
/// **Quick start with the built-in verbs**:
/// {@snippet :
/// var env = ParlanceFactory.createEnvironment();
/// }
///
/// @see ParlanceEnvironment
/// @see ParlanceConfig
/// @see Builder
public final class ParlanceFactory {

    private static final Logger logger = Logger.getLogger(ParlanceFactory.class.getName());

    private ParlanceFactory() {}

    /// Creates an environment with default configuration and the built-in verbs.
    ///
    /// @return a fully-configured environment, never null
    public static ParlanceEnvironment createEnvironment() {
        return createEnvironment(new ParlanceConfig());
    }

    /// Creates an environment with custom configuration and the built-in verbs.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static ParlanceEnvironment createEnvironment(ParlanceConfig config) {
        return createEnvironment(config, List.of());
    }

    /// Creates an environment with the built-in verbs plus additional modules.
    ///
    /// @param config configuration options, not null
    /// @param modules extra verb modules, not null (may be empty)
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if no verb could be registered
    public static ParlanceEnvironment createEnvironment(
            ParlanceConfig config, List<? extends VerbModule> modules) {
        return builder().config(config).verbModules(modules).build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private static ExecutorService createHttpExecutor(int size) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads =
                runnable -> {
                    Thread thread = new Thread(runnable, "parlance-http-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newFixedThreadPool(Math.max(1, size), threads);
    }

    /// Fluent builder for constructing {@link ParlanceEnvironment} instances.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private ParlanceConfig config = new ParlanceConfig();
        private final List<VerbModule> modules = new ArrayList<>();
        private final List<Supplier<? extends Verb>> verbs = new ArrayList<>();
        private VerbRegistry verbRegistry;
        private StructuredValueReader structuredValueReader = new MapStructuredValueReader();
        private PrintStream output = System.out;
        private boolean includeBuiltinVerbs = true;

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(ParlanceConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Adds a verb module.
        ///
        /// @param module module registering one or more verbs, not null
        /// @return this builder for chaining, never null
        public Builder verbModule(VerbModule module) {
            modules.add(Objects.requireNonNull(module, "module must not be null"));
            return this;
        }

        /// Adds several verb modules.
        ///
        /// @param modules modules to add, not null
        /// @return this builder for chaining, never null
        public Builder verbModules(List<? extends VerbModule> modules) {
            modules.forEach(this::verbModule);
            return this;
        }

        /// Registers a single verb factory.
        ///
        /// @param factory verb factory, not null
        /// @return this builder for chaining, never null
        public Builder verb(Supplier<? extends Verb> factory) {
            verbs.add(Objects.requireNonNull(factory, "factory must not be null"));
            return this;
        }

        /// Sets a custom verb registry. Modules and verbs are still registered into it.
        ///
        /// @param verbRegistry the registry, may be null for default
        /// @return this builder for chaining, never null
        public Builder verbRegistry(VerbRegistry verbRegistry) {
            this.verbRegistry = verbRegistry;
            return this;
        }

        /// Sets how results are read for destructuring.
        ///
        /// @param reader reader, not null
        /// @return this builder for chaining, never null
        public Builder structuredValueReader(StructuredValueReader reader) {
            this.structuredValueReader = Objects.requireNonNull(reader, "reader must not be null");
            return this;
        }

        /// Sets the stream printing verbs write to.
        ///
        /// @param output output stream, not null
        /// @return this builder for chaining, never null
        public Builder output(PrintStream output) {
            this.output = Objects.requireNonNull(output, "output must not be null");
            return this;
        }

        /// Enables or disables the built-in verbs (`GET`, `SAVE`, `SAY`, ...).
        ///
        /// @param include `false` to start from an empty vocabulary
        /// @return this builder for chaining, never null
        public Builder includeBuiltinVerbs(boolean include) {
            this.includeBuiltinVerbs = include;
            return this;
        }

        /// Builds and returns the configured {@link ParlanceEnvironment}.
        ///
        /// @apiNote **Side effects**: creates the HTTP thread pool
        ///
        /// @return the configured environment, never null
        /// @throws IllegalStateException if no verb could be registered
        public ParlanceEnvironment build() {
            VerbRegistry registry = verbRegistry != null ? verbRegistry : new DefaultVerbRegistry();
            if (includeBuiltinVerbs) {
                new BuiltinVerbs().register(registry);
            }
            modules.forEach(module -> module.register(registry));
            verbs.forEach(registry::register);
            registry.refresh();
            if (registry.size() == 0) {
                throw new IllegalStateException("No verbs registered; the interpreter cannot run");
            }

            ExecutorService httpExecutor = createHttpExecutor(config.getHttpThreadPoolSize());
            HttpClient httpClient =
                    HttpClient.newBuilder()
                            .executor(httpExecutor)
                            .connectTimeout(config.getHttpTimeout())
                            .followRedirects(HttpClient.Redirect.NORMAL)
                            .build();
            VerbServices services =
                    new VerbServices(
                            output, config.getWorkingDirectory(), httpClient, config.getHttpTimeout());

            TokenMatcher matcher = TokenMatcher.create(config.isUseRegexMatchers());
            Lexicon lexicon = new Lexicon(registry);
            Tokenizer tokenizer = new Tokenizer();
            WordFactory wordFactory = new WordFactory(registry, lexicon, matcher);
            SentenceValidator validator = new SentenceValidator(lexicon);
            SentenceFactory sentenceFactory =
                    new SentenceFactory(wordFactory, new Dispatcher(registry, lexicon));
            SentenceExecutor executor =
                    new SentenceExecutor(structuredValueReader, matcher, services);

            ParlanceEngine engine =
                    new ParlanceEngine(
                            ExecutionPipeline.standard(
                                    tokenizer, wordFactory, validator, sentenceFactory, executor),
                            ExecutionPipeline.validationOnly(
                                    tokenizer, wordFactory, validator, sentenceFactory),
                            new VariableTable(matcher),
                            config.getVariableScope());

            logger.info(
                    "Parlance environment ready: "
                            + registry.size()
                            + " verb(s), scope "
                            + config.getVariableScope()
                            + ", working directory "
                            + config.getWorkingDirectory().toAbsolutePath().normalize());

            return new ParlanceEnvironment(
                    engine, registry, lexicon, services, config, httpExecutor);
        }
    }
}
