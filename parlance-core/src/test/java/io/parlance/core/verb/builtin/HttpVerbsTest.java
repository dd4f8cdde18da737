package io.parlance.core.verb.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.parlance.core.ParlanceConfig;
import io.parlance.core.ParlanceEngine;
import io.parlance.core.ParlanceEnvironment;
import io.parlance.core.ParlanceFactory;
import io.parlance.core.execution.ExecutionResult;
import io.parlance.core.value.Value;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HttpVerbsTest {

    @TempDir Path workingDirectory;

    private HttpServer server;
    private String baseUrl;
    private ParlanceEnvironment environment;
    private ParlanceEngine engine;
    private final AtomicReference<String> postedBody = new AtomicReference<>();
    private final AtomicReference<String> postedType = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/files/report.txt", exchange -> respond(exchange, 200, "report body"));
        server.createContext("/files/missing", exchange -> respond(exchange, 404, "gone"));
        server.createContext(
                "/api/items",
                exchange -> {
                    postedBody.set(
                            new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                    postedType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
                    respond(exchange, 201, "{\"id\":7}");
                });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        environment =
                ParlanceFactory.createEnvironment(
                        ParlanceConfig.builder()
                                .workingDirectory(workingDirectory)
                                .httpTimeout(Duration.ofSeconds(10))
                                .httpThreadPoolSize(1)
                                .build());
        engine = environment.getEngine();
    }

    @AfterEach
    void tearDown() {
        environment.close();
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Nested
    class Download {

        @Test
        void shouldSaveUnderUrlFileNameInWorkingDirectory() throws Exception {
            ExecutionResult result =
                    engine.run("DOWNLOAD [file] FROM {" + baseUrl + "/files/report.txt}.");

            assertThat(result.isSuccess()).as(result.failureReason()).isTrue();
            Path saved = workingDirectory.resolve("report.txt");
            assertThat(result.result()).isEqualTo(new Value.Handle(saved));
            assertThat(Files.readString(saved)).isEqualTo("report body");
        }

        @Test
        void shouldSaveToExplicitTarget() throws Exception {
            ExecutionResult result =
                    engine.run(
                            "DOWNLOAD [file] FROM {" + baseUrl + "/files/report.txt} TO {in/copy.txt}.");

            assertThat(result.isSuccess()).as(result.failureReason()).isTrue();
            assertThat(Files.readString(workingDirectory.resolve("in/copy.txt")))
                    .isEqualTo("report body");
        }

        @Test
        void shouldFailOnHttpError() {
            ExecutionResult result = engine.run("DOWNLOAD [file] FROM {" + baseUrl + "/files/missing}.");

            assertThat(result.failureReason())
                    .isEqualTo("Failed to download file from " + baseUrl + "/files/missing: HTTP 404");
            assertThat(workingDirectory.resolve("missing.bin")).doesNotExist();
        }

        @Test
        void shouldRejectNonHttpSource() {
            ExecutionResult result = engine.run("DOWNLOAD [file] FROM {ftp://example.com/a.txt}.");

            assertThat(result.failureReason())
                    .isEqualTo("Cannot resolve '{ftp://example.com/a.txt}' for FROM of DOWNLOAD FILE");
        }

        @ParameterizedTest
        @CsvSource({
            "http://host/a/report.txt, report.txt",
            "http://host/, downloaded_file.bin",
            "http://host, downloaded_file.bin",
            "http://host/data, data.bin",
            "http://host/.hidden, .hidden.bin"
        })
        void shouldDeriveFileName(String url, String expected) {
            assertThat(DownloadFile.fileName(URI.create(url))).isEqualTo(expected);
        }
    }

    @Nested
    class Post {

        @Test
        void shouldSendJsonAndReturnResponseBody() {
            ExecutionResult result = engine.run("POST {{\"name\":\"pen\"}} TO {" + baseUrl + "/api/items}.");

            assertThat(result.isSuccess()).as(result.failureReason()).isTrue();
            assertThat(result.result()).isEqualTo(Value.text("{\"id\":7}"));
            assertThat(postedBody.get()).isEqualTo("{\"name\":\"pen\"}");
            assertThat(postedType.get()).startsWith("application/json");
        }

        @Test
        void shouldRejectRelativeTarget() {
            ExecutionResult result = engine.run("POST {{}} TO {api/items}.");

            assertThat(result.failureReason())
                    .isEqualTo("Cannot resolve '{api/items}' for TO of POST JSON");
        }
    }

    @Test
    void shouldNotSendWhenCancelled() {
        ExecutionResult result =
                engine.run("DOWNLOAD [file] FROM {" + baseUrl + "/files/report.txt}.", () -> true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureReason()).startsWith("DOWNLOAD cancelled before sending");
        assertThat(workingDirectory.resolve("report.txt")).doesNotExist();
    }
}
