package org.springaicommunity.pensieve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link SnapshotStore} keeping the snapshot in a JSON file.
 *
 * <p>
 * Writes go to a temporary file in the same directory which is then moved over the
 * target, atomically where the file system supports it. A file that cannot be parsed or
 * has another format version is ignored with a warning; the next refresh replaces it.
 */
public class FileSystemSnapshotStore implements SnapshotStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemSnapshotStore.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	public FileSystemSnapshotStore(Path file, ObjectMapper objectMapper) {
		this.file = file.toAbsolutePath();
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<CacheSnapshot> read() {
		if (!Files.exists(file)) {
			logger.debug("No cache file at {}", file);
			return Optional.empty();
		}

		try {
			JsonNode root = objectMapper.readTree(file.toFile());
			int version = root.path("version").asInt(-1);
			if (version != CacheSnapshot.CURRENT_VERSION) {
				logger.warn("Ignoring cache file {} with format version {} (expected {})", file, version,
						CacheSnapshot.CURRENT_VERSION);
				return Optional.empty();
			}
			return Optional.of(objectMapper.treeToValue(root, CacheSnapshot.class));
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void write(CacheSnapshot snapshot) {
		Path directory = file.getParent();
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, file.getFileName() + ".", ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
			try {
				Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Wrote {} repositories to {}", snapshot.repositories().size(), file);
		}
		catch (IOException e) {
			deleteQuietly(temp);
			throw new PensieveException("Failed to write cache file " + file, e);
		}
	}

	private static void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			logger.warn("Could not delete temporary cache file {}: {}", temp, e.getMessage());
		}
	}

}
