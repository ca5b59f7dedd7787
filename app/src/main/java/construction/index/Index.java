package construction.index;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named tensor slot ranging over {@code [from, to]}, either covariant (down) or contravariant
 * (up).
 *
 * <p>Equality and ordering only look at the identity of the index (name and range); the
 * covariance flag is carried along for contraction detection and printing.
 */
public final class Index implements Comparable<Index> {
  static final List<String> GREEK =
      List.of(
          "mu", "nu", "rho", "sigma", "tau", "lambda", "kappa", "alpha", "beta", "delta", "eta",
          "theta", "iota", "xi", "pi", "phi", "chi", "psi", "omega");

  private static final int GREEK_ORDER_OFFSET = 100;
  private static final int UNORDERED = 10_000;

  private final String name;
  private final String printable;
  private final Range range;
  private final boolean contravariant;
  private final int order;

  public Index(String name, String printable, Range range, boolean contravariant, int order) {
    this.name = Objects.requireNonNull(name, "name");
    this.printable = Objects.requireNonNull(printable, "printable");
    this.range = Objects.requireNonNull(range, "range");
    this.contravariant = contravariant;
    this.order = order;
  }

  /** Covariant index whose ordering key is derived from its name. */
  public static Index of(String name, Range range) {
    return new Index(name, defaultPrintable(name), range, false, orderOf(name));
  }

  public static Index of(String name, int from, int to) {
    return of(name, Range.of(from, to));
  }

  /**
   * An index over the range and in the position of {@code like} whose name is not in {@code
   * taken}. Roman letters are tried first, then Greek names.
   */
  public static Index freshLike(Index like, Set<String> taken) {
    for (char c = 'a'; c <= 'z'; c++) {
      String name = String.valueOf(c);
      if (!taken.contains(name)) {
        return of(name, like.range).withContravariant(like.contravariant);
      }
    }
    for (String name : GREEK) {
      if (!taken.contains(name)) {
        return of(name, like.range).withContravariant(like.contravariant);
      }
    }
    int suffix = 1;
    while (taken.contains(like.name + suffix)) {
      suffix++;
    }
    return of(like.name + suffix, like.range).withContravariant(like.contravariant);
  }

  static int orderOf(String name) {
    if (name.length() == 1 && Character.isLowerCase(name.charAt(0))) {
      return name.charAt(0) - 'a';
    }
    int greek = GREEK.indexOf(name);
    if (greek >= 0) {
      return GREEK_ORDER_OFFSET + greek;
    }
    return UNORDERED;
  }

  private static String defaultPrintable(String name) {
    return GREEK.contains(name) ? "\\" + name : name;
  }

  public String name() {
    return name;
  }

  public String printable() {
    return printable;
  }

  public Range range() {
    return range;
  }

  public boolean isContravariant() {
    return contravariant;
  }

  public int order() {
    return order;
  }

  public Index withContravariant(boolean up) {
    if (up == contravariant) {
      return this;
    }
    return new Index(name, printable, range, up, order);
  }

  public Index flipped() {
    return withContravariant(!contravariant);
  }

  /** Same name and range, opposite position. */
  public boolean contractsWith(Index other) {
    return equals(other) && contravariant != other.contravariant;
  }

  @Override
  public int compareTo(Index other) {
    int cmp = Integer.compare(order, other.order);
    if (cmp != 0) {
      return cmp;
    }
    cmp = name.compareTo(other.name);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(range.from(), other.range.from());
    return cmp != 0 ? cmp : Integer.compare(range.to(), other.range.to());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Index other)) {
      return false;
    }
    return name.equals(other.name) && range.equals(other.range);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, range);
  }

  @Override
  public String toString() {
    return printable;
  }
}
