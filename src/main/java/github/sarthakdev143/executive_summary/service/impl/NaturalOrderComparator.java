package github.sarthakdev143.executive_summary.service.impl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders file names so that embedded numbers compare by value: {@code frame_2} before {@code frame_10}.
 * Names are split into alternating non-digit and digit runs; text runs compare case-insensitively.
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    private NaturalOrderComparator() {
    }

    @Override
    public int compare(String left, String right) {
        List<String> leftRuns = splitRuns(left);
        List<String> rightRuns = splitRuns(right);
        int shared = Math.min(leftRuns.size(), rightRuns.size());
        for (int index = 0; index < shared; index++) {
            int result = compareRuns(leftRuns.get(index), rightRuns.get(index));
            if (result != 0) {
                return result;
            }
        }
        int bySize = Integer.compare(leftRuns.size(), rightRuns.size());
        return bySize != 0 ? bySize : left.compareTo(right);
    }

    private int compareRuns(String left, String right) {
        boolean leftDigits = isDigitRun(left);
        boolean rightDigits = isDigitRun(right);
        if (leftDigits && rightDigits) {
            return new BigInteger(left).compareTo(new BigInteger(right));
        }
        if (leftDigits != rightDigits) {
            // Numbers sort before text.
            return leftDigits ? -1 : 1;
        }
        return left.toLowerCase(Locale.ROOT).compareTo(right.toLowerCase(Locale.ROOT));
    }

    static List<String> splitRuns(String value) {
        List<String> runs = new ArrayList<>();
        int start = 0;
        for (int index = 1; index <= value.length(); index++) {
            if (index == value.length()
                    || Character.isDigit(value.charAt(index)) != Character.isDigit(value.charAt(index - 1))) {
                runs.add(value.substring(start, index));
                start = index;
            }
        }
        return runs;
    }

    private static boolean isDigitRun(String run) {
        return !run.isEmpty() && Character.isDigit(run.charAt(0));
    }
}
