package com.cipherchat.client.keystore;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cipherchat.crypto.AgreementKeyPair;
import com.cipherchat.crypto.PrivateKey;
import com.cipherchat.crypto.PublicKey;
import com.cipherchat.crypto.StorageUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Durable key store backed by a single JSON document.
 *
 * <p>Every operation re-reads the file and rewrites it through a temporary file
 * followed by an atomic rename, so a crash never leaves a half-written store.
 * Operations on one instance are serialized; the file is created owner-read/write
 * only where the file system supports POSIX permissions.
 */
public class FileKeyStore implements KeyStore {
    private static final Logger logger = LoggerFactory.getLogger(FileKeyStore.class);

    private static final TypeReference<LinkedHashMap<UUID, StoredKeyPair>> ENTRIES =
            new TypeReference<>() {};
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path file;
    private final ObjectMapper mapper;
    private final Object lock = new Object();

    public FileKeyStore(Path file, ObjectMapper mapper) {
        this.file = requireNonNull(file, "file").toAbsolutePath();
        this.mapper = requireNonNull(mapper, "mapper");
    }

    public FileKeyStore(Path file) {
        this(file, new ObjectMapper());
    }

    @Override
    public boolean putIfAbsent(UUID conversationId, PrivateKey privateKey, PublicKey publicKey) {
        requireNonNull(conversationId, "conversationId");
        requireNonNull(privateKey, "privateKey");
        requireNonNull(publicKey, "publicKey");

        synchronized (lock) {
            Map<UUID, StoredKeyPair> entries = read();
            try {
                if (entries.containsKey(conversationId)) {
                    logger.debug("Key pair for conversation {} already stored, keeping it", conversationId);
                    return false;
                }
                entries.put(conversationId, StoredKeyPair.of(privateKey, publicKey));
                write(entries);
                logger.info("Stored key pair for conversation {}", conversationId);
                return true;
            } finally {
                entries.values().forEach(StoredKeyPair::wipe);
            }
        }
    }

    @Override
    public Optional<AgreementKeyPair> get(UUID conversationId) {
        synchronized (lock) {
            Map<UUID, StoredKeyPair> entries = read();
            try {
                StoredKeyPair stored = entries.get(conversationId);
                if (stored == null) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(stored.toKeyPair());
                } catch (RuntimeException e) {
                    throw new StorageUnavailableException(
                            "Stored key pair for conversation " + conversationId + " is corrupt", e);
                }
            } finally {
                entries.values().forEach(StoredKeyPair::wipe);
            }
        }
    }

    @Override
    public boolean remove(UUID conversationId) {
        synchronized (lock) {
            Map<UUID, StoredKeyPair> entries = read();
            try {
                if (entries.remove(conversationId) == null) {
                    return false;
                }
                write(entries);
                logger.info("Removed key pair for conversation {}", conversationId);
                return true;
            } finally {
                entries.values().forEach(StoredKeyPair::wipe);
            }
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            try {
                Files.deleteIfExists(file);
                logger.info("Wiped key store {}", file);
            } catch (IOException e) {
                throw new StorageUnavailableException("Could not wipe key store " + file, e);
            }
        }
    }

    private Map<UUID, StoredKeyPair> read() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<UUID, StoredKeyPair> entries = mapper.readValue(file.toFile(), ENTRIES);
            return entries != null ? entries : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new StorageUnavailableException("Could not read key store " + file, e);
        }
    }

    private void write(Map<UUID, StoredKeyPair> entries) {
        Path tmp = null;
        try {
            Path dir = file.getParent();
            Files.createDirectories(dir);
            tmp = supportsPosix(dir)
                    ? Files.createTempFile(dir, ".keys", ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY))
                    : Files.createTempFile(dir, ".keys", ".tmp");
            mapper.writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new StorageUnavailableException("Could not write key store " + file, e);
        }
    }

    private static boolean supportsPosix(Path dir) {
        return dir.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    private static void deleteQuietly(Path tmp, IOException cause) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
