package com.pywire.parser.loader.cst;

import java.util.Arrays;

/** Maps character offsets of a source text to 0-based rows and columns. */
public final class LineIndex {
    private final int length;
    private final int[] lineStarts;

    public LineIndex(String source) {
        this.length = source.length();
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < length; i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int rowOf(int offset) {
        int clamped = clamp(offset);
        int index = Arrays.binarySearch(lineStarts, clamped);
        return index >= 0 ? index : -index - 2;
    }

    public int columnOf(int offset) {
        int clamped = clamp(offset);
        return clamped - lineStarts[rowOf(clamped)];
    }

    public int lineCount() {
        return lineStarts.length;
    }

    private int clamp(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        return Math.min(offset, length);
    }
}
