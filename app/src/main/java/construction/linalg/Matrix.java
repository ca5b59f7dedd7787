package construction.linalg;

import com.google.common.base.Preconditions;
import construction.scalar.Fraction;
import java.util.Arrays;

/** Dense matrix of exact rationals with in-place Gauss-Jordan reduction. */
public final class Matrix {
  private final Fraction[][] entries;
  private final int rows;
  private final int columns;

  public Matrix(int rows, int columns) {
    Preconditions.checkArgument(rows >= 0 && columns >= 0, "Negative size %sx%s", rows, columns);
    this.rows = rows;
    this.columns = columns;
    this.entries = new Fraction[rows][columns];
    for (Fraction[] row : entries) {
      Arrays.fill(row, Fraction.ZERO);
    }
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public Fraction get(int row, int column) {
    return entries[row][column];
  }

  /** Writes one cell. Distinct cells may be written from different threads. */
  public void set(int row, int column, Fraction value) {
    entries[row][column] = value;
  }

  /**
   * Reduces the matrix to reduced row echelon form: every non-zero row starts with a leading 1,
   * which is the only non-zero entry of its column, and zero rows come last.
   *
   * @return the rank
   */
  public int toRowEchelonForm() {
    int pivotRow = 0;
    for (int column = 0; column < columns && pivotRow < rows; column++) {
      int source = pivotRow;
      while (source < rows && entries[source][column].isZero()) {
        source++;
      }
      if (source == rows) {
        continue;
      }
      swapRows(source, pivotRow);
      Fraction pivot = entries[pivotRow][column];
      for (int j = column; j < columns; j++) {
        entries[pivotRow][j] = entries[pivotRow][j].dividedBy(pivot);
      }
      for (int i = 0; i < rows; i++) {
        if (i == pivotRow || entries[i][column].isZero()) {
          continue;
        }
        Fraction factor = entries[i][column];
        for (int j = column; j < columns; j++) {
          entries[i][j] = entries[i][j].minus(factor.times(entries[pivotRow][j]));
        }
      }
      pivotRow++;
    }
    return pivotRow;
  }

  /** Column of the first non-zero entry of {@code row}, or -1 for a zero row. */
  public int pivotColumn(int row) {
    for (int column = 0; column < columns; column++) {
      if (!entries[row][column].isZero()) {
        return column;
      }
    }
    return -1;
  }

  private void swapRows(int a, int b) {
    if (a != b) {
      Fraction[] tmp = entries[a];
      entries[a] = entries[b];
      entries[b] = tmp;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Fraction[] row : entries) {
      sb.append(Arrays.toString(row)).append('\n');
    }
    return sb.toString();
  }
}
