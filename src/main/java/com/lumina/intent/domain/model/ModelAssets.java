package com.lumina.intent.domain.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public record ModelAssets(Path modelFile, Optional<Path> grammarFile) {
    public ModelAssets {
        Objects.requireNonNull(modelFile, "modelFile");
        grammarFile = grammarFile == null ? Optional.empty() : grammarFile;
    }
}
