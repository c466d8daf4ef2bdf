package com.salesops.crmsync.service.backup;

import java.util.Optional;

/**
 * Where backup payloads live. Payloads are opaque bytes; encoding and checksums are handled by
 * the caller.
 */
public interface BackupStorage {

    void write(String backupId, byte[] data);

    Optional<byte[]> read(String backupId);

    /**
     * @return {@code true} if a payload existed and was removed
     */
    boolean delete(String backupId);
}
