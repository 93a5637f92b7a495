package io.treesitter.handles;

/**
 * A position in source text.
 *
 * @param row the zero-based line number
 * @param column the zero-based byte offset within the line
 */
public record Point(int row, int column) implements Comparable<Point> {

  /** The start of any document. */
  public static final Point ORIGIN = new Point(0, 0);

  @Override
  public int compareTo(Point other) {
    int byRow = Integer.compare(row, other.row);
    return byRow != 0 ? byRow : Integer.compare(column, other.column);
  }

  @Override
  public String toString() {
    return "(" + row + ", " + column + ")";
  }
}
