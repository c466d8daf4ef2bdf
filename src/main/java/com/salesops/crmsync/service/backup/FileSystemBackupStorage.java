package com.salesops.crmsync.service.backup;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.BackupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each backup as {@code backup_<id>.json} under {@code app.backup.storage-path}. Files are
 * written to a temporary name first and moved into place.
 */
@Slf4j
@Component
public class FileSystemBackupStorage implements BackupStorage {

    private final Path directory;

    public FileSystemBackupStorage(CrmSyncProperties properties) {
        this.directory = Paths.get(properties.getBackup().getStoragePath());
    }

    @Override
    public void write(String backupId, byte[] data) {
        Path target = pathFor(backupId);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "backup_" + backupId, ".tmp");
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} bytes to {}", data.length, target);
        } catch (IOException e) {
            throw new BackupException("Could not write backup file " + target, e);
        }
    }

    @Override
    public Optional<byte[]> read(String backupId) {
        Path path = pathFor(backupId);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BackupException("Could not read backup file " + path, e);
        }
    }

    @Override
    public boolean delete(String backupId) {
        Path path = pathFor(backupId);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new BackupException("Could not delete backup file " + path, e);
        }
    }

    Path pathFor(String backupId) {
        return directory.resolve("backup_" + backupId + ".json");
    }
}
