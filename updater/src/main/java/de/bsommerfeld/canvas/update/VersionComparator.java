package de.bsommerfeld.canvas.update;

import java.util.Comparator;

/**
 * Orders dotted numeric versions ({@code 5.3.10 > 5.3.9}). Missing segments
 * count as zero, so {@code 1.2 == 1.2.0}. Non-numeric segments also count as
 * zero.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {
    }

    @Override
    public int compare(String a, String b) {
        String[] left = a.trim().split("\\.");
        String[] right = b.trim().split("\\.");
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            int cmp = Long.compare(segment(left, i), segment(right, i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    public static boolean isNewer(String candidate, String current) {
        return INSTANCE.compare(candidate, current) > 0;
    }

    private static long segment(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Long.parseLong(parts[index]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
