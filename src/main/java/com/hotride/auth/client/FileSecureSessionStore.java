package com.hotride.auth.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One file per slot under a directory. Writes go to a temp file that is then moved into place, so a
 * slot is either its old or its new value, never a torn write. On POSIX file systems files are created
 * {@code rw-------}.
 */
public class FileSecureSessionStore implements SecureSessionStore {

    private static final Pattern SLOT_NAME = Pattern.compile("[a-z_]+");
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final boolean posix;

    public FileSecureSessionStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SessionStoreException("Cannot create session directory " + directory, e);
        }
        this.posix = Files.getFileAttributeView(directory, PosixFileAttributeView.class) != null;
    }

    @Override
    public Optional<String> get(String slot) {
        try {
            return Optional.of(Files.readString(slotPath(slot), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new SessionStoreException("Cannot read slot " + slot, e);
        }
    }

    @Override
    public void put(String slot, String value) {
        Path target = slotPath(slot);
        try {
            Path temp = posix
                    ? Files.createTempFile(directory, slot, ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY))
                    : Files.createTempFile(directory, slot, ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SessionStoreException("Cannot write slot " + slot, e);
        }
    }

    @Override
    public void delete(String slot) {
        try {
            Files.deleteIfExists(slotPath(slot));
        } catch (IOException e) {
            throw new SessionStoreException("Cannot delete slot " + slot, e);
        }
    }

    @Override
    public StorageGuarantee guarantee() {
        return posix ? StorageGuarantee.OWNER_ONLY_FILE : StorageGuarantee.PLAIN_FILE;
    }

    private Path slotPath(String slot) {
        if (slot == null || !SLOT_NAME.matcher(slot).matches()) {
            throw new IllegalArgumentException("Invalid slot name: " + slot);
        }
        return directory.resolve(slot);
    }
}
