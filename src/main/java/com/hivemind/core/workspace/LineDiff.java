package com.hivemind.core.workspace;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based unified diff with three lines of context, in the format of {@code diff -u}.
 */
final class LineDiff {

    private static final int CONTEXT = 3;

    /** Above this many LCS cells the middle section is reported as a full replacement. */
    private static final long MAX_CELLS = 25_000_000L;

    private LineDiff() {
    }

    private enum OpType { EQUAL, DELETE, INSERT }

    private record Op(OpType type, int oldIndex, int newIndex, String line) {
    }

    static List<String> unified(String path, List<String> oldLines, List<String> newLines) {
        List<Op> ops = editScript(oldLines, newLines);
        List<String> out = new ArrayList<>();

        int i = 0;
        while (i < ops.size()) {
            if (ops.get(i).type() == OpType.EQUAL) {
                i++;
                continue;
            }
            int start = Math.max(0, i - CONTEXT);
            int lastChange = i;
            int j = i + 1;
            while (j < ops.size()) {
                if (ops.get(j).type() != OpType.EQUAL) {
                    lastChange = j;
                } else if (j - lastChange > 2 * CONTEXT) {
                    break;
                }
                j++;
            }
            int end = Math.min(ops.size() - 1, lastChange + CONTEXT);

            if (out.isEmpty()) {
                out.add("--- a/" + path);
                out.add("+++ b/" + path);
            }
            out.add(hunkHeader(ops, start, end));
            for (int k = start; k <= end; k++) {
                Op op = ops.get(k);
                char prefix = switch (op.type()) {
                    case EQUAL -> ' ';
                    case DELETE -> '-';
                    case INSERT -> '+';
                };
                out.add(prefix + op.line());
            }
            i = end + 1;
        }
        return out;
    }

    private static String hunkHeader(List<Op> ops, int start, int end) {
        int oldCount = 0;
        int newCount = 0;
        for (int k = start; k <= end; k++) {
            OpType type = ops.get(k).type();
            if (type != OpType.INSERT) {
                oldCount++;
            }
            if (type != OpType.DELETE) {
                newCount++;
            }
        }
        Op first = ops.get(start);
        return "@@ -" + range(first.oldIndex(), oldCount) + " +" + range(first.newIndex(), newCount) + " @@";
    }

    private static String range(int zeroBasedStart, int length) {
        int beginning = zeroBasedStart + 1;
        if (length == 1) {
            return String.valueOf(beginning);
        }
        if (length == 0) {
            beginning--;
        }
        return beginning + "," + length;
    }

    private static List<Op> editScript(List<String> a, List<String> b) {
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        List<Op> ops = new ArrayList<>();
        for (int k = 0; k < prefix; k++) {
            ops.add(new Op(OpType.EQUAL, k, k, a.get(k)));
        }

        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);
        if ((long) midA.size() * midB.size() > MAX_CELLS) {
            for (int k = 0; k < midA.size(); k++) {
                ops.add(new Op(OpType.DELETE, prefix + k, prefix, midA.get(k)));
            }
            for (int k = 0; k < midB.size(); k++) {
                ops.add(new Op(OpType.INSERT, prefix + midA.size(), prefix + k, midB.get(k)));
            }
        } else {
            appendLcsOps(midA, midB, prefix, ops);
        }

        for (int k = 0; k < suffix; k++) {
            int oi = a.size() - suffix + k;
            int ni = b.size() - suffix + k;
            ops.add(new Op(OpType.EQUAL, oi, ni, a.get(oi)));
        }
        return ops;
    }

    private static void appendLcsOps(List<String> a, List<String> b, int offset, List<Op> ops) {
        int n = a.size();
        int m = b.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int x = n - 1; x >= 0; x--) {
            for (int y = m - 1; y >= 0; y--) {
                lcs[x][y] = a.get(x).equals(b.get(y))
                        ? lcs[x + 1][y + 1] + 1
                        : Math.max(lcs[x + 1][y], lcs[x][y + 1]);
            }
        }
        int x = 0;
        int y = 0;
        while (x < n || y < m) {
            if (x < n && y < m && a.get(x).equals(b.get(y))) {
                ops.add(new Op(OpType.EQUAL, offset + x, offset + y, a.get(x)));
                x++;
                y++;
            } else if (y < m && (x == n || lcs[x][y + 1] > lcs[x + 1][y])) {
                ops.add(new Op(OpType.INSERT, offset + x, offset + y, b.get(y)));
                y++;
            } else {
                ops.add(new Op(OpType.DELETE, offset + x, offset + y, a.get(x)));
                x++;
            }
        }
    }
}
