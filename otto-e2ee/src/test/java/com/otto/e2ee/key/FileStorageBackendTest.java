package com.otto.e2ee.key;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileStorageBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void setThenGet_roundTripsAcrossInstances() throws Exception {
        Path dir = tempDir.resolve("keys");
        new FileStorageBackend(dir).set(StorageKeys.IDENTITY_SEED_HEX, "abc".getBytes(StandardCharsets.US_ASCII));

        byte[] read = new FileStorageBackend(dir).get(StorageKeys.IDENTITY_SEED_HEX);

        assertThat(new String(read, StandardCharsets.US_ASCII)).isEqualTo("abc");
        assertThat(Files.exists(dir.resolve(StorageKeys.IDENTITY_SEED_HEX + ".key"))).isTrue();
    }

    @Test
    void get_missingKeyReturnsNull() throws Exception {
        assertThat(new FileStorageBackend(tempDir).get("absent")).isNull();
    }

    @Test
    void set_overwritesAndLeavesNoTempFile() throws Exception {
        FileStorageBackend backend = new FileStorageBackend(tempDir);
        backend.set("entry", new byte[]{1});
        backend.set("entry", new byte[]{2, 3});

        assertThat(backend.get("entry")).containsExactly(2, 3);
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("entry.key");
        }
    }

    @Test
    void delete_isIdempotent() throws Exception {
        FileStorageBackend backend = new FileStorageBackend(tempDir);
        backend.set("entry", new byte[]{1});

        backend.delete("entry");
        backend.delete("entry");

        assertThat(backend.get("entry")).isNull();
    }

    @Test
    void set_restrictsFileToOwner() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        FileStorageBackend backend = new FileStorageBackend(tempDir);

        backend.set("entry", new byte[]{1});

        assertThat(Files.getPosixFilePermissions(tempDir.resolve("entry.key")))
                .containsExactlyInAnyOrder(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);
    }

    @Test
    void rejectsKeysThatCouldEscapeTheDirectory() {
        FileStorageBackend backend = new FileStorageBackend(tempDir);

        assertThatThrownBy(() -> backend.get("../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.set("UPPER", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isPersistent() {
        assertThat(new FileStorageBackend(tempDir).isPersistent()).isTrue();
    }
}
