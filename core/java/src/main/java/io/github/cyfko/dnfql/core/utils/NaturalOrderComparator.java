package io.github.cyfko.dnfql.core.utils;

import java.util.Comparator;
import java.util.Locale;

/**
 * Case-insensitive "natural" string ordering: runs of ASCII digits compare by numeric value,
 * everything else compares by lower-cased text.
 * <p>
 * A string is read as alternating segments {@code text, number, text, number, ...} (the first
 * text segment may be empty), so segments at the same index always have the same kind.
 * </p>
 * <pre>{@code
 * "A2"  < "A10"
 * "a1"  = "A1"    // case-insensitive
 * "A01" = "A1"    // numeric value only
 * }</pre>
 * <p>
 * The comparison is not consistent with {@code equals}; callers that need a total order
 * chain a raw comparison after it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {}

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        boolean digits = false;

        while (true) {
            int endA = segmentEnd(a, i, digits);
            int endB = segmentEnd(b, j, digits);

            int cmp = digits
                    ? compareNumeric(a, i, endA, b, j, endB)
                    : a.substring(i, endA).toLowerCase(Locale.ROOT).compareTo(b.substring(j, endB).toLowerCase(Locale.ROOT));
            if (cmp != 0) return cmp;

            boolean aDone = endA >= a.length();
            boolean bDone = endB >= b.length();
            if (aDone || bDone) {
                return Boolean.compare(!aDone, !bDone);
            }

            i = endA;
            j = endB;
            digits = !digits;
        }
    }

    private static int segmentEnd(String s, int from, boolean digits) {
        int k = from;
        while (k < s.length() && isAsciiDigit(s.charAt(k)) == digits) {
            k++;
        }
        return k;
    }

    private static int compareNumeric(String a, int fromA, int toA, String b, int fromB, int toB) {
        // strip leading zeros, then longer means larger
        while (fromA < toA - 1 && a.charAt(fromA) == '0') fromA++;
        while (fromB < toB - 1 && b.charAt(fromB) == '0') fromB++;
        int lenA = toA - fromA;
        int lenB = toB - fromB;
        if (lenA != lenB) return Integer.compare(lenA, lenB);
        return a.substring(fromA, toA).compareTo(b.substring(fromB, toB));
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
