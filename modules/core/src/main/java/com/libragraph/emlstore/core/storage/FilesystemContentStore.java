package com.libragraph.emlstore.core.storage;

import com.libragraph.emlstore.util.ContentHash;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Filesystem-backed ContentStore.
 *
 * <p>Layout: {@code {baseDir}/cas/{hash}}, one file per distinct payload.
 * New blobs are written to {@code cas/.tmp-*}, forced to disk and then moved
 * into place atomically.
 */
public class FilesystemContentStore implements ContentStore {

    private static final Logger log = Logger.getLogger(FilesystemContentStore.class);

    public static final String CAS_DIR = "cas";
    static final String TEMP_PREFIX = ".tmp-";

    private final Path root;

    public FilesystemContentStore(Path baseDir) {
        Objects.requireNonNull(baseDir, "baseDir cannot be null");
        this.root = baseDir.resolve(CAS_DIR);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Failed to create CAS directory: " + root, e);
        }
    }

    /** The {@code cas/} directory holding the blobs. */
    public Path root() {
        return root;
    }

    private Path resolvePath(ContentHash hash) {
        return root.resolve(hash.toHex());
    }

    @Override
    public StoreResult storeIfAbsent(ContentHash hash, byte[] bytes) {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Path target = resolvePath(hash);
        if (Files.exists(target)) {
            return new StoreResult(hash, bytes.length, false);
        }

        Path temp = root.resolve(TEMP_PREFIX + hash.toHex() + "-" + UUID.randomUUID());
        try {
            try (FileChannel out = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                out.force(true);
            }
            moveIntoPlace(temp, target);
            log.debugf("Stored blob %s (%d bytes)", hash, bytes.length);
            return new StoreResult(hash, bytes.length, true);
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(temp);
            return new StoreResult(hash, bytes.length, false);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to write blob: " + hash, e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf("Could not remove temporary file %s: %s", temp, e.getMessage());
        }
    }

    @Override
    public boolean exists(ContentHash hash) {
        return Files.isRegularFile(resolvePath(hash));
    }

    @Override
    public OptionalLong size(ContentHash hash) {
        try {
            return OptionalLong.of(Files.size(resolvePath(hash)));
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to stat blob: " + hash, e);
        }
    }

    @Override
    public Optional<InputStream> open(ContentHash hash) {
        try {
            return Optional.of(Files.newInputStream(resolvePath(hash)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to open blob: " + hash, e);
        }
    }

    @Override
    public byte[] read(ContentHash hash) {
        try {
            return Files.readAllBytes(resolvePath(hash));
        } catch (NoSuchFileException e) {
            throw new BlobNotFoundException(hash);
        } catch (IOException e) {
            throw new StorageException("Failed to read blob: " + hash, e);
        }
    }

    @Override
    public boolean delete(ContentHash hash) {
        try {
            boolean removed = Files.deleteIfExists(resolvePath(hash));
            if (removed) {
                log.debugf("Deleted blob %s", hash);
            }
            return removed;
        } catch (IOException e) {
            throw new StorageException("Failed to delete blob: " + hash, e);
        }
    }

    @Override
    public int deleteAll() {
        int removed = 0;
        for (ContentHash hash : list()) {
            if (delete(hash)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<ContentHash> list() {
        List<ContentHash> hashes = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (ContentHash.isHex(name) && Files.isRegularFile(entry)) {
                    hashes.add(ContentHash.fromHex(name));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list CAS directory: " + root, e);
        }
        return hashes;
    }

    @Override
    public int sweepTemporaryFiles() {
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, TEMP_PREFIX + "*")) {
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
                removed++;
            }
        } catch (IOException e) {
            throw new StorageException("Failed to sweep CAS directory: " + root, e);
        }
        if (removed > 0) {
            log.infof("Removed %d interrupted blob writes from %s", removed, root);
        }
        return removed;
    }
}
