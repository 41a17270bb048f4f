package com.example.compliance.service;

import java.util.StringJoiner;

/**
 * Cache key derivation. A key is a pure function of the stage name, the model identifier,
 * the hash of the input content and every parameter that changes the result.
 */
public final class CacheKeys {

    private static final String SEPARATOR = "\u001f";

    private CacheKeys() {
    }

    public static String of(String stage, String model, String contentHash, Object... params) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        joiner.add(stage).add(model).add(contentHash);
        for (Object p : params) {
            joiner.add(String.valueOf(p));
        }
        return Hashes.sha256(joiner.toString());
    }
}
