package xml.java17.xmlmap;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// A process-wide JAXP factory (or other shared helper) created on first use.
///
/// Creation happens at most once even under concurrent first access. A factory lookup
/// that fails is reported as an [XmlMapException] naming the constant, and is retried
/// on the next call.
final class LazyConstant<T> {

    private static final Logger LOG = Logger.getLogger(LazyConstant.class.getName());

    private final String name;
    private final Supplier<T> factory;
    private volatile T instance;

    private LazyConstant(String name, Supplier<T> factory) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    static <T> LazyConstant<T> of(String name, Supplier<T> factory) {
        return new LazyConstant<>(name, factory);
    }

    T get() {
        final var existing = instance;
        if (existing != null) {
            return existing;
        }
        synchronized (this) {
            if (instance == null) {
                instance = create();
            }
            return instance;
        }
    }

    private T create() {
        final T created;
        try {
            created = factory.get();
        } catch (RuntimeException | Error e) {
            throw new XmlMapException("Failed to create " + name, e);
        }
        if (created == null) {
            throw new XmlMapException("Factory for " + name + " returned null");
        }
        LOG.fine(() -> "Created shared " + name);
        return created;
    }

    @Override
    public String toString() {
        return "LazyConstant[" + name + (instance == null ? "" : ", created") + "]";
    }
}
