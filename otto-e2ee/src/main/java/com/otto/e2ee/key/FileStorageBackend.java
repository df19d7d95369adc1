package com.otto.e2ee.key;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Secure storage backed by owner-only files, one file per key.
 *
 * Stands in for a platform keychain on the desktop JVM. Writes go to a temp file
 * that is atomically moved over the target.
 */
public class FileStorageBackend implements SecureStorageBackend {

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9_]{1,64}");
    private static final String SUFFIX = ".key";

    /** Owner read/write only */
    private static final Set<PosixFilePermission> FILE_PERMISSIONS = EnumSet.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE
    );

    private final Path directory;

    public FileStorageBackend(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Storage directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public byte[] get(String key) throws SecureStorageException {
        Path path = resolve(key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new SecureStorageException("Failed to read " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) throws SecureStorageException {
        Path path = resolve(key);
        try {
            Files.createDirectories(directory);
            Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
            Files.write(tempPath, value);
            setFilePermissions(tempPath);
            Files.move(tempPath, path,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SecureStorageException("Failed to write " + key, e);
        }
    }

    @Override
    public void delete(String key) throws SecureStorageException {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new SecureStorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public boolean isPersistent() {
        return true;
    }

    /**
     * Keys become file names, so only {@code [a-z0-9_]{1,64}} is accepted.
     */
    @Override
    public void validateKey(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
    }

    private Path resolve(String key) {
        validateKey(key);
        return directory.resolve(key + SUFFIX);
    }

    private void setFilePermissions(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, FILE_PERMISSIONS);
        } catch (UnsupportedOperationException e) {
            // Non-POSIX file systems keep their default ACLs
        }
    }
}
