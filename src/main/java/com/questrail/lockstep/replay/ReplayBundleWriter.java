package com.questrail.lockstep.replay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes {@link ReplayBundle}s as pretty-printed UTF-8 JSON files named
 * {@code replay-<profile>-<seed>.json}.
 */
public final class ReplayBundleWriter
{
    private final Path directory;
    private final ObjectMapper mapper;

    public ReplayBundleWriter(Path directory) {
        this(directory, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReplayBundleWriter(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Writes the bundle, replacing any earlier bundle for the same profile and seed.
     *
     * @return the written file
     */
    public Path write(ReplayBundle bundle) throws IOException {
        Objects.requireNonNull(bundle, "bundle");
        Files.createDirectories(directory);
        Path target = directory.resolve(bundle.fileName());
        // Jackson writes UTF-8 when given raw bytes.
        Files.write(target, mapper.writeValueAsBytes(bundle));
        return target;
    }

    public Path directory() {
        return directory;
    }
}
