package org.learningjava.gaugeledger.domain.service.hashing;

import org.learningjava.gaugeledger.domain.model.fingerprint.HashedFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * SHA-256 fingerprints. Full digests are 64 hex characters; short digests keep the first 16,
 * which is what manifests, files and task sets are identified by.
 */
public final class ContentHasher {

    public static final int SHORT_HASH_LENGTH = 16;
    public static final int DISPLAY_HASH_LENGTH = 8;

    private ContentHasher() {
    }

    public static String hashBytes(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String content) {
        return hashBytes(content.getBytes(StandardCharsets.UTF_8));
    }

    public static String shortHash(String content) {
        return sha256Hex(content).substring(0, SHORT_HASH_LENGTH);
    }

    public static String shorten(String fullHash) {
        return shorten(fullHash, DISPLAY_HASH_LENGTH);
    }

    public static String shorten(String fullHash, int length) {
        return fullHash.length() <= length ? fullHash : fullHash.substring(0, length);
    }

    /** Short hash of a manifest; surrounding whitespace does not count. */
    public static String hashManifest(String manifestText) {
        return shortHash(manifestText.strip());
    }

    /** Full digest of the canonical JSON form of a configuration tree. */
    public static String hashCanonical(Object tree) {
        return sha256Hex(Canonicalizer.toCanonicalJson(tree));
    }

    /** Short digest of the canonical JSON form of a configuration tree. */
    public static String shortHashCanonical(Object tree) {
        return shorten(hashCanonical(tree), SHORT_HASH_LENGTH);
    }

    /**
     * Hashes the trimmed text content of a file. A file that does not exist is reported as empty,
     * not as an error; any other read failure propagates.
     */
    public static Optional<HashedFile> hashFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            String text = new String(bytes, StandardCharsets.UTF_8);
            return Optional.of(new HashedFile(normalizePath(path.toString()), hashManifest(text), bytes.length));
        } catch (NoSuchFileException e) {
            // deleted between the check and the read
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public static String normalizePath(String path) {
        return path.replace('\\', '/');
    }
}
