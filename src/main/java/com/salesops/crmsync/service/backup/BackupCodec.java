package com.salesops.crmsync.service.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.exception.BackupException;
import com.salesops.crmsync.exception.IntegrityException;
import com.salesops.crmsync.model.dto.BackupDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns a {@link BackupDocument} into stored bytes and back. Compressed payloads are gzipped
 * JSON, base64-encoded; the checksum is the SHA-256 of the stored bytes.
 */
@Component
public class BackupCodec {

    private final ObjectMapper objectMapper;

    public BackupCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param size           uncompressed JSON byte count
     * @param compressedSize gzip byte count, {@code null} when stored uncompressed
     */
    public record Encoded(byte[] data, long size, Long compressedSize) {}

    public Encoded encode(BackupDocument document, boolean compress) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new BackupException("Could not serialize backup " + document.metadata().backupId(), e);
        }
        if (!compress) {
            return new Encoded(json, json.length, null);
        }
        byte[] gzipped = gzip(json);
        return new Encoded(Base64.getEncoder().encode(gzipped), json.length, (long) gzipped.length);
    }

    public BackupDocument decode(byte[] data, boolean compressed) {
        try {
            byte[] json = compressed ? gunzip(Base64.getDecoder().decode(data)) : data;
            return objectMapper.readValue(json, BackupDocument.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new IntegrityException("Backup payload cannot be decoded", e);
        }
    }

    public String checksum(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new BackupException("Could not compress backup payload", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] data) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }
}
