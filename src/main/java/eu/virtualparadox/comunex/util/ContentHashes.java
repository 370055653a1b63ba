package eu.virtualparadox.comunex.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ContentHashes {

    private ContentHashes() {
        // prevent instantiation
    }

    /**
     * SHA-1 over every byte of the file; the identity of a stored PDF.
     */
    public static String sha1(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.sha1Hex(in);
        }
    }

    public static String sha256(final String value) {
        return DigestUtils.sha256Hex(value.getBytes(StandardCharsets.UTF_8));
    }
}
