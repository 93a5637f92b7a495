package io.treesitter.handles;

import java.util.Objects;

/**
 * A range from start (inclusive) to end (exclusive) over one coordinate space.
 *
 * <p>Used both for byte offsets ({@code Extent<Integer>}) and for row/column positions ({@code
 * Extent<Point>}).
 *
 * @param start the first coordinate covered by the range
 * @param end the first coordinate after the range
 * @param <T> the coordinate type
 */
public record Extent<T extends Comparable<? super T>>(T start, T end) {

  public Extent {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.compareTo(end) > 0) {
      throw new IllegalArgumentException("Extent start " + start + " is after end " + end);
    }
  }

  public static <T extends Comparable<? super T>> Extent<T> of(T start, T end) {
    return new Extent<>(start, end);
  }

  /** Returns true if the range covers no coordinates. */
  public boolean isEmpty() {
    return start.compareTo(end) == 0;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
