package hypersum.common.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public interface ListSupport {
  static <X, Y> List<Y> map(Iterable<? extends X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ys = new ArrayList<>();
    for (X x : xs) ys.add(func.apply(x));
    return ys;
  }
}
