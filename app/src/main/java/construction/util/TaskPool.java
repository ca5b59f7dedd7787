package construction.util;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bounded worker pool for independent units of work. Every call blocks until all submitted units
 * have completed; the pool is meant to be opened for one operation and closed afterwards.
 */
public final class TaskPool implements AutoCloseable {
  private final int parallelism;
  private final ForkJoinPool pool;

  public TaskPool(int parallelism) {
    Preconditions.checkArgument(parallelism > 0, "Parallelism must be positive: %s", parallelism);
    this.parallelism = parallelism;
    this.pool = parallelism > 1 ? new ForkJoinPool(parallelism) : null;
  }

  public int parallelism() {
    return parallelism;
  }

  /** Applies {@code task} to every item and returns the results in item order. */
  public <T, R> List<R> map(List<T> items, Function<? super T, ? extends R> task) {
    if (pool == null || items.size() < 2) {
      List<R> results = new ArrayList<>(items.size());
      for (T item : items) {
        results.add(task.apply(item));
      }
      return results;
    }
    return pool.submit(
            () -> items.parallelStream().map(task).collect(Collectors.<R>toList()))
        .join();
  }

  public <T> void forEach(List<T> items, Consumer<? super T> task) {
    if (pool == null || items.size() < 2) {
      items.forEach(task);
      return;
    }
    pool.submit(() -> items.parallelStream().forEach(task)).join();
  }

  @Override
  public void close() {
    if (pool != null) {
      pool.shutdown();
    }
  }
}
