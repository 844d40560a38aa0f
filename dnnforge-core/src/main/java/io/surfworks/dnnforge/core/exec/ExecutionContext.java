package io.surfworks.dnnforge.core.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.resource.ResourceKey;

/**
 * Per-execution state: kernel services and the native resources materialized
 * while running a graph.
 *
 * <p>Resources are created lazily the first time a node asks for them and are
 * released when the context closes. A caller that needs a handle beyond the
 * context's lifetime takes its own reference with {@link NativeHandle#retain()}.
 *
 * <p>Thread safety: a context is meant for one execution at a time.
 */
public final class ExecutionContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ExecutionContext.class.getName());

    private final Map<Class<?>, Object> services = new HashMap<>();
    private final Map<ResourceKey, NativeHandle> resources = new LinkedHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ExecutionContext() {
    }

    /**
     * Registers a service (a kernel library, an algorithm cache) for operators to look up.
     *
     * @return this context for chaining
     */
    public <T> ExecutionContext register(Class<T> type, T service) {
        checkNotClosed();
        services.put(type, type.cast(service));
        return this;
    }

    /**
     * Returns a registered service.
     *
     * @throws IllegalStateException if no service of that type is registered
     */
    public <T> T service(Class<T> type) {
        Object service = services.get(type);
        if (service == null) {
            throw new IllegalStateException("No " + type.getSimpleName() + " registered in execution context");
        }
        return type.cast(service);
    }

    /**
     * Returns the resource for {@code key}, creating it on first request.
     */
    public synchronized NativeHandle resource(ResourceKey key, Supplier<NativeHandle> factory) {
        checkNotClosed();
        NativeHandle handle = resources.get(key);
        if (handle == null) {
            handle = factory.get();
            resources.put(key, handle);
            LOG.fine(() -> "Materialized " + key.operator().kind() + " for shape " + key.shapeInput());
        }
        return handle;
    }

    /**
     * Number of resources this context currently holds.
     */
    public synchronized int resourceCount() {
        return resources.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Execution context has been closed");
        }
    }

    /**
     * Drops this context's reference to every resource it materialized.
     *
     * <p>Every handle is released even if an earlier release function fails;
     * the first failure is rethrown afterwards with any later ones suppressed.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            List<NativeHandle> held;
            synchronized (this) {
                held = new ArrayList<>(resources.values());
                resources.clear();
            }
            RuntimeException failure = null;
            for (NativeHandle handle : held) {
                try {
                    handle.release();
                } catch (RuntimeException e) {
                    LOG.warning("Failed to release " + handle + ": " + e.getMessage());
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
    }
}
