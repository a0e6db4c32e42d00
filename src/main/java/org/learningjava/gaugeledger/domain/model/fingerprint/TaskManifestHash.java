package org.learningjava.gaugeledger.domain.model.fingerprint;

/** A task id paired with the content hash of its manifest (or of the whole task). */
public record TaskManifestHash(String id, String contentHash) { }
