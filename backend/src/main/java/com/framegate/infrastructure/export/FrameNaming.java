package com.framegate.infrastructure.export;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Frame keys used for approved files and atlas entries: {@code {moveId}/{0000}}.
 */
public final class FrameNaming {

    public static final Pattern KEY_PATTERN = Pattern.compile("^[a-z_]+/\\d{4}$");
    public static final int MAX_INDEX = 9999;

    private FrameNaming() {
    }

    public static String frameKey(String moveId, int frameIndex) {
        if (frameIndex < 0 || frameIndex > MAX_INDEX) {
            throw new IllegalArgumentException("Frame index out of range 0-" + MAX_INDEX + ": " + frameIndex);
        }
        return moveId + "/" + String.format("%04d", frameIndex);
    }

    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    public static int indexOf(String key) {
        if (!isValidKey(key)) {
            throw new IllegalArgumentException("Not a frame key: " + key);
        }
        return Integer.parseInt(key.substring(key.lastIndexOf('/') + 1));
    }

    /**
     * Indices missing from {@code 0..max(index)} among the given keys, ascending.
     */
    public static List<Integer> findGaps(Collection<String> keys) {
        TreeSet<Integer> present = new TreeSet<>();
        for (String key : keys) {
            present.add(indexOf(key));
        }
        List<Integer> gaps = new ArrayList<>();
        if (present.isEmpty()) {
            return gaps;
        }
        for (int i = 0; i < present.last(); i++) {
            if (!present.contains(i)) {
                gaps.add(i);
            }
        }
        return gaps;
    }
}
