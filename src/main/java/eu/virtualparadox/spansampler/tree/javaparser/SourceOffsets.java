package eu.virtualparadox.spansampler.tree.javaparser;

import com.github.javaparser.Position;
import eu.virtualparadox.spansampler.tree.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Translates JavaParser positions (1-based line and column, counted in chars) into UTF-8 byte
 * offsets and zero-based byte {@link Point}s.
 * <p>Lines end at {@code \n}, {@code \r\n} or a lone {@code \r}, as in the JavaParser tokenizer.</p>
 */
final class SourceOffsets {

    /**
     * Char offset at which each line starts.
     */
    private final int[] lineStartChars;

    /**
     * Byte offset at which each line starts.
     */
    private final int[] lineStartBytes;

    /**
     * {@code byteOfChar[i]} is the UTF-8 byte offset of char {@code i}; the last entry is the total byte length.
     */
    private final int[] byteOfChar;

    SourceOffsets(final String source) {
        this.byteOfChar = computeByteOffsets(source);

        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            final char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }

        this.lineStartChars = starts.stream().mapToInt(Integer::intValue).toArray();
        this.lineStartBytes = new int[lineStartChars.length];
        for (int line = 0; line < lineStartChars.length; line++) {
            lineStartBytes[line] = byteOfChar[lineStartChars[line]];
        }
    }

    private static int[] computeByteOffsets(final String source) {
        final int[] offsets = new int[source.length() + 1];
        int bytes = 0;
        int i = 0;
        while (i < source.length()) {
            final int codePoint = source.codePointAt(i);
            offsets[i] = bytes;
            if (Character.isSupplementaryCodePoint(codePoint)) {
                offsets[i + 1] = bytes;
                bytes += 4;
                i += 2;
            } else {
                bytes += codePoint < 0x80 ? 1 : codePoint < 0x800 ? 2 : 3;
                i++;
            }
        }
        offsets[source.length()] = bytes;
        return offsets;
    }

    /**
     * @param position JavaParser position
     * @return char offset of the character at {@code position}, clamped to the source
     */
    int charOffset(final Position position) {
        final int line = Math.min(Math.max(position.line - 1, 0), lineStartChars.length - 1);
        final int offset = lineStartChars[line] + position.column - 1;
        return Math.min(Math.max(offset, 0), byteOfChar.length - 1);
    }

    int byteOffset(final int charOffset) {
        return byteOfChar[Math.min(charOffset, byteOfChar.length - 1)];
    }

    int byteLength() {
        return byteOfChar[byteOfChar.length - 1];
    }

    Point point(final int byteOffset) {
        // Line starts are strictly increasing
        int row = Arrays.binarySearch(lineStartBytes, byteOffset);
        if (row < 0) {
            row = -row - 2;
        }
        return new Point(row, byteOffset - lineStartBytes[row]);
    }
}
