package io.parlance.core.verb.builtin;

import io.parlance.core.verb.VerbModule;
import io.parlance.core.verb.VerbRegistry;

/// Registers the verbs every environment has unless told otherwise.
///
/// | Family | Usage | Form |
/// |--------|-------|------|
/// | `GET` | Text | `GET [lines] FROM file.` |
/// | `SAVE` | Text | `SAVE text TO file.` |
/// | `DELETE` | File | `DELETE [FROM] file.` |
/// | `SAY` (`ECHO`, `PRINT`, `OUTPUT`, `WRITE`) | Text | `SAY message.` |
/// | `LOAD` | Text | `LOAD [lines] FROM file.` |
/// | `DOWNLOAD` | File | `DOWNLOAD [file] FROM url [TO path].` |
/// | `POST` | Json | `POST payload TO url.` |
/// | `SEND` | Email | `SEND message TO recipient [WITH subject].` |
/// | `TRANSFORM` | Encoding | `TRANSFORM text USING charset.` |
public final class BuiltinVerbs implements VerbModule {

    @Override
    public void register(VerbRegistry registry) {
        registry.register(GetText::new);
        registry.register(SaveText::new);
        registry.register(DeleteFile::new);
        registry.register(SayText::new);
        registry.register(LoadText::new);
        registry.register(DownloadFile::new);
        registry.register(PostJson::new);
        registry.register(SendEmail::new);
        registry.register(TransformEncoding::new);
    }
}
