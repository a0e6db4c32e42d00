package org.learningjava.gaugeledger.domain.model.fingerprint;

import java.util.Locale;

/** Task category, taken from the directory a manifest lives under. */
public enum Difficulty {
    EASY, MEDIUM, HARD;

    public String dirName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
