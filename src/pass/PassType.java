package pass;

import java.util.function.Supplier;

/**
 * pass type factory; a pass type is selected by its name on the command line
 * or in the {@code ir.passes} property
 */
public interface PassType<T extends Pass> {
    /* constructor */
    Supplier<T> constructor();

    /** default factory method: constructor().get() */
    default T create() {
        return constructor().get();
    }

    /** the selecting name, the enum name in lower case unless overridden */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }

    /** names are compared trimmed and case-insensitively */
    default boolean matches(String name) {
        return name != null && getName().equalsIgnoreCase(name.trim());
    }
}
