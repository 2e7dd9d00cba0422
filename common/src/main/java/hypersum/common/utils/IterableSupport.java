package hypersum.common.utils;

import java.util.function.Predicate;

public interface IterableSupport {
  static <T> boolean any(Iterable<T> xs, Predicate<? super T> check) {
    for (T x : xs) if (check.test(x)) return true;
    return false;
  }

  static <T> boolean all(Iterable<T> xs, Predicate<? super T> check) {
    for (T x : xs) if (!check.test(x)) return false;
    return true;
  }
}
