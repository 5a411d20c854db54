package eu.virtualparadox.spansampler.tree;

/**
 * Zero-based (row, column) position inside a source file.
 * <p>The column counts bytes from the start of the row. End points are exclusive.</p>
 *
 * @param row    zero-based line index
 * @param column zero-based byte column within the line
 */
public record Point(int row, int column) {

    public String asString() {
        return row + ":" + column;
    }
}
