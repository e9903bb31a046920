package com.autorestart.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Owner-only, all-or-nothing JSON writes.
 */
public final class JsonFile {

    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonFile() {
    }

    /**
     * Serialize {@code value} next to {@code target}, fsync it, then rename it
     * into place. A crash leaves either the previous document or the new one.
     */
    public static void writeAtomically(Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        byte[] bytes = PRETTY.writeValueAsBytes(value);

        Path staging = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel out = FileChannel.open(staging, StandardOpenOption.WRITE)) {
                out.write(ByteBuffer.wrap(bytes));
                out.write(ByteBuffer.wrap(new byte[]{'\n'}));
                out.force(true);
            }
            ownerOnly(staging);
            replace(staging, target);
        } finally {
            Files.deleteIfExists(staging);
        }
    }

    private static void replace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, REPLACE_EXISTING);
        }
    }

    private static void ownerOnly(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
