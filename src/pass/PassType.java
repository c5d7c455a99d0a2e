package pass;

import java.util.Set;
import java.util.function.Supplier;

/**
 * pass type factory
 */
public interface PassType<T extends Pass> {
    /* constructor */
    Supplier<T> constructor();

    /** option keys the pass accepts */
    Set<String> optionKeys();

    /** default factory method: constructor().get() */
    default T create() {
        return constructor().get();
    }

    /** the pipeline id, e.g. "copy-propagation" */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase().replace('_', '-');
    }
}
