package io.pactverifier.source;

import io.pactverifier.ErrorCode;
import io.pactverifier.VerifierException;
import io.pactverifier.model.PactDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a pact document from the local filesystem.
 */
public final class FilePactSource implements PactSource {

    private final Path path;

    public FilePactSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public PactDocument read() throws VerifierException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE, "pact file not found: " + path, ex);
        } catch (IOException ex) {
            throw new VerifierException(ErrorCode.SOURCE_UNAVAILABLE, "read pact file " + path + ": " + ex.getMessage(), ex);
        }
        return PactParser.parse(bytes, location());
    }

    @Override
    public String location() {
        return path.toString();
    }
}
