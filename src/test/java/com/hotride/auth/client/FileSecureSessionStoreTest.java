package com.hotride.auth.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSecureSessionStoreTest {

    @TempDir
    Path directory;

    @Test
    void putThenGet_roundTripsValue() {
        FileSecureSessionStore store = new FileSecureSessionStore(directory.resolve("session"));

        store.put("auth_token", "token-1");

        assertThat(store.get("auth_token")).contains("token-1");
        assertThat(store.get("user_data")).isEmpty();
    }

    @Test
    void put_overwritesAndLeavesNoTempFiles() throws Exception {
        FileSecureSessionStore store = new FileSecureSessionStore(directory);

        store.put("auth_token", "token-1");
        store.put("auth_token", "token-2");

        assertThat(store.get("auth_token")).contains("token-2");
        try (var files = Files.list(directory)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("auth_token");
        }
    }

    @Test
    void delete_missingSlot_isNoOp() {
        FileSecureSessionStore store = new FileSecureSessionStore(directory);

        store.delete("auth_token");
        store.put("auth_token", "token-1");
        store.delete("auth_token");

        assertThat(store.get("auth_token")).isEmpty();
    }

    @Test
    void slotName_withPathCharacters_isRejected() {
        FileSecureSessionStore store = new FileSecureSessionStore(directory);

        assertThatThrownBy(() -> store.put("../escape", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get("Auth-Token")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void put_onPosix_createsOwnerOnlyFile() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        FileSecureSessionStore store = new FileSecureSessionStore(directory);

        store.put("auth_token", "token-1");

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(directory.resolve("auth_token"))))
                .isEqualTo("rw-------");
        assertThat(store.guarantee()).isEqualTo(StorageGuarantee.OWNER_ONLY_FILE);
    }
}
