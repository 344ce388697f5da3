package fr.lapetina.modeltraffic.infrastructure.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.modeltraffic.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Snapshot store writing one JSON document per key into a directory.
 *
 * Keys are URL-encoded into file names. Writes go to a temporary file which is then
 * moved over the target, so a crash never leaves a half-written snapshot behind.
 */
public final class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileSnapshotStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create snapshot directory: " + directory, e);
        }
        log.info("Snapshot store initialized: directory={}", directory.toAbsolutePath());
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + key + " from " + file, e);
        }
    }

    @Override
    public void put(String key, Object snapshot) {
        Path file = fileFor(key);
        Path temp = directory.resolve(file.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Snapshot written: key={}, file={}", key, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + key + " to " + file, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete snapshot " + key, e);
        }
    }

    /**
     * Lists stored keys, sorted.
     */
    public Set<String> keys() {
        Set<String> keys = new TreeSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> URLDecoder.decode(
                            name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8))
                    .forEach(keys::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list snapshots in " + directory, e);
        }
        return keys;
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Snapshot key is required");
        }
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
