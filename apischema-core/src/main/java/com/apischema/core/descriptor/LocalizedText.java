package com.apischema.core.descriptor;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Help text whose value is looked up only when it is first needed, typically from a
 * message bundle for the current locale.
 *
 * <p>{@link #toString()} forces the lookup; the resolved value is cached.
 */
public final class LocalizedText implements CharSequence {

    private final Supplier<String> resolver;
    private volatile String resolved;

    private LocalizedText(Supplier<String> resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Creates lazily resolved text.
     *
     * @param resolver supplies the concrete text on first use
     * @return lazy text
     */
    public static LocalizedText lazy(Supplier<String> resolver) {
        return new LocalizedText(resolver);
    }

    /**
     * Returns whether the text has been resolved yet.
     *
     * @return true after the first call to {@link #toString()}
     */
    public boolean isResolved() {
        return resolved != null;
    }

    @Override
    public int length() {
        return toString().length();
    }

    @Override
    public char charAt(int index) {
        return toString().charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return toString().subSequence(start, end);
    }

    @Override
    public String toString() {
        String value = resolved;
        if (value == null) {
            value = Objects.requireNonNullElse(resolver.get(), "");
            resolved = value;
        }
        return value;
    }
}
