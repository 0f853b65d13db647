package com.causalloops.graph;

import java.util.Comparator;
import java.util.List;

/** Shorter sequences first, then element-wise by {@link #compareNames}. */
public final class LoopOrder implements Comparator<List<String>> {
    public static final LoopOrder INSTANCE = new LoopOrder();

    private LoopOrder() {}

    /**
     * Orders names by Unicode code point, which is also UTF-8 byte order. {@link String#compareTo}
     * compares UTF-16 units and puts supplementary characters before U+E000..U+FFFF.
     */
    public static int compareNames(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public int compare(List<String> a, List<String> b) {
        if (a.size() != b.size()) return Integer.compare(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            int c = compareNames(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return 0;
    }
}
