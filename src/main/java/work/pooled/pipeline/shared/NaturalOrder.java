package work.pooled.pipeline.shared;

import java.util.Comparator;

/**
 * Orders identifier strings so that numeric runs compare by value ({@code A2 < A10}, {@code 2 < 10}).
 */
public final class NaturalOrder implements Comparator<String> {
    public static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {}

    @Override
    public int compare(String left, String right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            char a = left.charAt(i);
            char b = right.charAt(j);
            if (Character.isDigit(a) && Character.isDigit(b)) {
                int startA = i;
                int startB = j;
                while (i < left.length() && Character.isDigit(left.charAt(i))) i++;
                while (j < right.length() && Character.isDigit(right.charAt(j))) j++;
                int cmp = compareDigits(left.substring(startA, i), right.substring(startB, j));
                if (cmp != 0) {
                    return cmp;
                }
                continue;
            }
            if (a != b) {
                return Character.compare(a, b);
            }
            i++;
            j++;
        }
        int remaining = Integer.compare(left.length() - i, right.length() - j);
        return remaining != 0 ? remaining : left.compareTo(right);
    }

    private static int compareDigits(String a, String b) {
        String trimmedA = stripLeadingZeros(a);
        String trimmedB = stripLeadingZeros(b);
        if (trimmedA.length() != trimmedB.length()) {
            return Integer.compare(trimmedA.length(), trimmedB.length());
        }
        int cmp = trimmedA.compareTo(trimmedB);
        return cmp != 0 ? cmp : Integer.compare(a.length(), b.length());
    }

    private static String stripLeadingZeros(String digits) {
        int index = 0;
        while (index < digits.length() - 1 && digits.charAt(index) == '0') {
            index++;
        }
        return digits.substring(index);
    }
}
