package io.parlance.core.verb.builtin;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbInstance;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// `DOWNLOAD [file] FROM url [TO path].` saves an `http`/`https` resource to disk.
///
/// Without `TO` the file lands in the working directory under the URL's last
/// path segment. The result is the saved path.
public final class DownloadFile implements Verb {

    private static final Logger logger = Logger.getLogger(DownloadFile.class.getName());

    static final String DEFAULT_FILE_NAME = "downloaded_file";
    static final String DEFAULT_EXTENSION = ".bin";

    @Override
    public String name() {
        return "DOWNLOAD";
    }

    @Override
    public String usage() {
        return "File";
    }

    @Override
    public Set<Role> roles() {
        return Set.of(Role.WHAT, Role.FROM, Role.TO);
    }

    @Override
    public Set<Role> optionalRoles() {
        return Set.of(Role.TO);
    }

    @Override
    public boolean producesWhat() {
        return true;
    }

    @Override
    public Optional<Value> resolve(Role role, String text) {
        return switch (role) {
            case FROM -> HttpVerbs.httpUri(text);
            case TO -> FileVerbs.path(text);
            default -> Optional.of(Value.text(text));
        };
    }

    @Override
    public Value act(VerbInstance instance) throws VerbExecutionException {
        URI source = instance.uri(Role.FROM);
        Path target =
                instance.value(Role.TO).isPresent()
                        ? instance.path(Role.TO)
                        : instance.services().workingDirectory().resolve(fileName(source));

        HttpRequest request =
                HttpRequest.newBuilder(source)
                        .timeout(instance.services().httpTimeout())
                        .GET()
                        .build();
        HttpResponse<byte[]> response =
                HttpVerbs.send(instance, request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() >= 400) {
            throw new VerbExecutionException(
                    "Failed to download file from " + source + ": HTTP " + response.statusCode());
        }

        try {
            FileVerbs.createParents(target);
            Files.write(target, response.body());
        } catch (IOException e) {
            throw new VerbExecutionException(
                    "Cannot write download to " + target + ": " + e.getMessage(), e);
        }
        logger.fine(() -> "Downloaded " + response.body().length + " bytes to " + target);
        return new Value.Handle(target);
    }

    /// Derives a local file name from the last path segment of a URL.
    static String fileName(URI source) {
        String path = source.getPath();
        String name = "";
        if (path != null) {
            int slash = path.lastIndexOf('/');
            name = slash >= 0 ? path.substring(slash + 1) : path;
        }
        if (name.isBlank()) {
            name = DEFAULT_FILE_NAME;
        }
        if (name.lastIndexOf('.') <= 0) {
            name += DEFAULT_EXTENSION;
        }
        return name;
    }
}
