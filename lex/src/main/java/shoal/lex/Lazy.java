package shoal.lex;

import java.util.function.Supplier;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class Lazy<T> implements Supplier<T> {

    static <T> Lazy<T> lazy(@NonNull Supplier<T> supplier) {
        return new Lazy<>(supplier, null);
    }

    private volatile Supplier<T> supplier;
    private volatile T value;

    @Override
    public T get() {
        var pending = supplier;
        if (pending != null) {
            var computed = pending.get();
            // value must be visible before the supplier is cleared
            value = computed;
            supplier = null;
            return computed;
        }
        return value;
    }
}
