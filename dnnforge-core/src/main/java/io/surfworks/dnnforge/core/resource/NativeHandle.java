package io.surfworks.dnnforge.core.resource;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.function.LongConsumer;
import java.util.logging.Logger;

import io.surfworks.dnnforge.core.graph.HandleType;

/**
 * A reference-counted native handle with a registered release function.
 *
 * <p>A handle starts with one reference. {@link #retain()} adds one for every
 * additional holder and {@link #release()} drops one; the release function runs
 * exactly once, when the count reaches zero.
 */
public final class NativeHandle {

    private static final Logger LOG = Logger.getLogger(NativeHandle.class.getName());

    private static final AtomicIntegerFieldUpdater<NativeHandle> REF_COUNT =
            AtomicIntegerFieldUpdater.newUpdater(NativeHandle.class, "refCount");

    private final HandleType type;
    private final long address;
    private final LongConsumer releaseFunction;
    private volatile int refCount = 1;

    public NativeHandle(HandleType type, long address, LongConsumer releaseFunction) {
        this.type = type;
        this.address = address;
        this.releaseFunction = releaseFunction;
    }

    public HandleType type() {
        return type;
    }

    /**
     * The native address.
     *
     * @throws IllegalStateException if the handle has been released
     */
    public long address() {
        if (refCount < 1) {
            throw new IllegalStateException(type.nativeTypeName() + " handle used after release");
        }
        return address;
    }

    public int refCount() {
        return refCount;
    }

    public boolean isReleased() {
        return refCount < 1;
    }

    /**
     * Adds a reference.
     *
     * @throws IllegalStateException if the handle has already been released
     */
    public NativeHandle retain() {
        for (;;) {
            int current = refCount;
            if (current < 1) {
                throw new IllegalStateException("retain() cannot be called after the handle is released");
            }
            if (REF_COUNT.compareAndSet(this, current, current + 1)) {
                return this;
            }
        }
    }

    /**
     * Drops a reference, running the release function when none remain.
     *
     * @return true if this call released the native resource
     * @throws IllegalStateException if the handle has already been released
     */
    public boolean release() {
        for (;;) {
            int current = refCount;
            if (current < 1) {
                throw new IllegalStateException("release() cannot be called after the handle is released");
            }
            if (REF_COUNT.compareAndSet(this, current, current - 1)) {
                if (current == 1) {
                    LOG.fine(() -> "Releasing " + type.nativeTypeName() + " via " + type.releaseFunction());
                    releaseFunction.accept(address);
                    return true;
                }
                return false;
            }
        }
    }

    @Override
    public String toString() {
        return "NativeHandle[" + type.nativeTypeName() + "@0x" + Long.toHexString(address)
                + ", refs=" + refCount + "]";
    }
}
