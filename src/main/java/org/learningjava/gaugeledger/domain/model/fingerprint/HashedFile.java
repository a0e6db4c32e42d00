package org.learningjava.gaugeledger.domain.model.fingerprint;

/**
 * @param path project-relative path with '/' separators
 * @param hash 16-hex short digest of the trimmed content
 * @param size file size in bytes
 */
public record HashedFile(String path, String hash, long size) {
    public HashedFile withPath(String newPath) {
        return new HashedFile(newPath, hash, size);
    }
}
