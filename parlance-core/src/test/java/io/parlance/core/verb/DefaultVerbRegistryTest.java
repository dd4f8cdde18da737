package io.parlance.core.verb;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parlance.core.exception.VerbNotFoundException;
import io.parlance.core.verb.builtin.BuiltinVerbs;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultVerbRegistryTest {

    private DefaultVerbRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultVerbRegistry();
    }

    @Nested
    class Lookup {

        @Test
        void shouldFindVerbByNameIgnoringCase() {
            registry.register(TestVerb.builder("Get", "Text").supplier());

            assertThat(registry.isVerb("get")).isTrue();
            assertThat(registry.isVerb("GET")).isTrue();
            assertThat(registry.family("gEt")).hasValue("GET");
        }

        @Test
        void shouldMapSynonymsToFamily() {
            registry.register(TestVerb.builder("SAY", "Text").synonyms("echo", "Print").supplier());

            assertThat(registry.family("ECHO")).hasValue("SAY");
            assertThat(registry.family("print")).hasValue("SAY");
            assertThat(registry.names()).contains("SAY", "ECHO", "PRINT");
        }

        @Test
        void shouldReturnEmptyForUnknownName() {
            assertThat(registry.isVerb("FLY")).isFalse();
            assertThat(registry.isVerb(null)).isFalse();
            assertThat(registry.family("FLY")).isEmpty();
            assertThat(registry.candidates("FLY")).isEmpty();
        }

        @Test
        void shouldThrowForUnknownVerbOnGetOrThrow() {
            assertThatThrownBy(() -> registry.getOrThrow("fly"))
                    .isInstanceOf(VerbNotFoundException.class)
                    .hasMessage("Unknown verb: 'fly'");
        }

        @Test
        void shouldOrderCandidatesByPriorityThenRegistration() throws Exception {
            registry.register(TestVerb.builder("LOAD", "Text").supplier());
            registry.register(TestVerb.builder("LOAD", "Lines").supplier());
            registry.register(TestVerb.builder("LOAD", "Config").priority(10).supplier());

            List<VerbDescriptor> candidates = registry.candidates("load");

            assertThat(candidates)
                    .extracting(VerbDescriptor::usage)
                    .containsExactly("Config", "Text", "Lines");
            assertThat(registry.getOrThrow("LOAD").usage()).isEqualTo("Config");
        }
    }

    @Nested
    class Probing {

        @Test
        void shouldSkipVerbsThatFailToConstruct() {
            registry.register(
                    () -> {
                        throw new IllegalStateException("broken plugin");
                    });
            registry.register(TestVerb.builder("SAY", "Text").supplier());

            assertThat(registry.all()).extracting(VerbDescriptor::id).containsExactly("SAY TEXT");
        }

        @Test
        void shouldSkipVerbsWithoutName() {
            registry.register(TestVerb.builder(" ", "Text").supplier());

            assertThat(registry.size()).isZero();
        }

        @Test
        void shouldDescribeRolesAndArity() {
            registry.register(
                    TestVerb.builder("DOWNLOAD", "File")
                            .roles(Role.WHAT, Role.FROM, Role.TO)
                            .optional(Role.TO, Role.USING)
                            .producesWhat()
                            .supplier());

            VerbDescriptor descriptor = registry.candidates("DOWNLOAD").get(0);

            assertThat(descriptor.id()).isEqualTo("DOWNLOAD FILE");
            assertThat(descriptor.arity()).isEqualTo(3);
            assertThat(descriptor.isOptional(Role.TO)).isTrue();
            assertThat(descriptor.isOptional(Role.USING)).isFalse();
            assertThat(descriptor.producesWhat()).isTrue();
        }

        @Test
        void shouldCreateFreshInstancesForDispatch() {
            AtomicInteger created = new AtomicInteger();
            registry.register(
                    () -> {
                        created.incrementAndGet();
                        return TestVerb.builder("SAY", "Text").build();
                    });

            VerbDescriptor descriptor = registry.candidates("SAY").get(0);
            int afterProbe = created.get();
            Verb first = descriptor.newInstance();
            Verb second = descriptor.newInstance();

            assertThat(first).isNotSameAs(second);
            assertThat(created.get()).isEqualTo(afterProbe + 2);
        }

        @Test
        void shouldIndexBuiltinModule() {
            new BuiltinVerbs().register(registry);

            assertThat(registry.size()).isEqualTo(9);
            assertThat(registry.family("write")).hasValue("SAY");
        }
    }

    @Nested
    class Maintenance {

        @Test
        void shouldKeepVersionWhenRefreshFindsNoChange() {
            registry.register(TestVerb.builder("SAY", "Text").supplier());
            long version = registry.version();

            registry.refresh();
            registry.refresh();

            assertThat(registry.version()).isEqualTo(version);
        }

        @Test
        void shouldBumpVersionWhenPluginSetChanges() {
            registry.register(TestVerb.builder("SAY", "Text").supplier());
            long version = registry.version();

            registry.register(TestVerb.builder("GET", "Text").supplier());

            assertThat(registry.version()).isGreaterThan(version);
            assertThat(registry.isVerb("GET")).isTrue();
        }

        @Test
        void shouldRescanAfterClear() {
            registry.register(TestVerb.builder("SAY", "Text").supplier());
            long version = registry.version();

            registry.clear();

            assertThat(registry.version()).isGreaterThan(version);
            assertThat(registry.isVerb("SAY")).isTrue();
        }

        @Test
        void shouldRejectNullFactory() {
            assertThatThrownBy(() -> registry.register(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("factory must not be null");
        }
    }
}
