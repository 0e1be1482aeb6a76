package com.linlay.agentsview.sync;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content digests used for change detection.
 */
public final class FileHashes {

    private static final int BUFFER_SIZE = 64 * 1024;

    private FileHashes() {
    }

    public static String computeHash(InputStream inputStream) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * @throws IOException wrapping the underlying failure with the path; the cause is a
     *                     {@link java.nio.file.NoSuchFileException} when the file is missing
     */
    public static String computeFileHash(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            throw new IOException("hashing " + path + ": is a directory");
        }
        InputStream inputStream;
        try {
            inputStream = Files.newInputStream(path);
        } catch (IOException ex) {
            throw new IOException("opening " + path, ex);
        }
        try (inputStream) {
            return computeHash(inputStream);
        } catch (IOException ex) {
            throw new IOException("hashing " + path, ex);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
