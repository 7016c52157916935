package com.strategylab.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each mirror as {@code <jobId>.json} in one directory. Writes go to a temporary
 * file that is then moved over the old one, so a crash mid-write leaves the previous
 * version intact.
 */
public class FileBatchJobMirrorStore implements BatchJobMirrorStore {

    private static final Logger log = LoggerFactory.getLogger(FileBatchJobMirrorStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileBatchJobMirrorStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create mirror directory " + directory, e);
        }
    }

    @Override
    public Optional<BatchJobMirror> get(String jobId) {
        Path file = fileOf(jobId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return read(file);
    }

    @Override
    public void put(BatchJobMirror mirror) {
        if (mirror.getId() == null || mirror.getId().isBlank()) {
            throw new IllegalArgumentException("Mirror has no job id");
        }
        Path target = fileOf(mirror.getId());
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, safeName(mirror.getId()), ".tmp");
            objectMapper.writeValue(temp.toFile(), mirror);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write mirror of batch job " + mirror.getId(), e);
        }
    }

    @Override
    public List<BatchJobMirror> findAll() {
        List<BatchJobMirror> mirrors = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                read(file).ifPresent(mirrors::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list mirrors in " + directory, e);
        }
        mirrors.sort(Comparator.comparing(
                BatchJobMirror::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return mirrors;
    }

    @Override
    public void delete(String jobId) {
        try {
            Files.deleteIfExists(fileOf(jobId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete mirror of batch job " + jobId, e);
        }
    }

    private Optional<BatchJobMirror> read(Path file) {
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), BatchJobMirror.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable batch job mirror {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileOf(String jobId) {
        return directory.resolve(safeName(jobId) + SUFFIX);
    }

    private static String safeName(String jobId) {
        return jobId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temporary mirror file {}: {}", temp, e.getMessage());
        }
    }
}
