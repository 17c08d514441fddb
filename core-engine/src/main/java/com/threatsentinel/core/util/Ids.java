package com.threatsentinel.core.util;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates short, prefixed, roughly time-ordered identifiers such as
 * {@code alert-lz3k9q1c-4f2ab}.
 */
public final class Ids {

    private Ids() {
        // utility class, not instantiable
    }

    public static String next(String prefix) {
        String time = Long.toString(System.currentTimeMillis(), 36);
        String random = Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36 * 36), 36);
        return (prefix + '-' + time + '-' + random).toLowerCase(Locale.ROOT);
    }
}
