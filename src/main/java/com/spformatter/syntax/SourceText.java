package com.spformatter.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Source text shared by all nodes of one tree. Maps character offsets to
 * row/column points and to UTF-8 byte offsets.
 */
public final class SourceText {
    private final String text;
    private final int[] lineStarts;
    private final int[] byteOffsets;

    public SourceText(String text) {
        this.text = text;

        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();

        this.byteOffsets = new int[text.length() + 1];
        int bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            byteOffsets[i] = bytes;
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                byteOffsets[++i] = bytes;
                continue;
            }
            bytes += String.valueOf(c).getBytes(StandardCharsets.UTF_8).length;
        }
        byteOffsets[text.length()] = bytes;
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public String slice(int start, int end) {
        return text.substring(start, end);
    }

    public Point pointAt(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new Point(low, offset - lineStarts[low]);
    }

    public int byteOffset(int offset) {
        return byteOffsets[offset];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
