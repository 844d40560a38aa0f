package io.surfworks.dnnforge.core.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.core.graph.HandleType;
import io.surfworks.dnnforge.core.ops.ShapeOf;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.resource.ResourceKey;

@DisplayName("ExecutionContext")
class ExecutionContextTest {

    private static final HandleType DESC = new HandleType("testDescriptor_t", "testDestroyDescriptor");

    @Test
    @DisplayName("materializes a resource once per key")
    void cachesPerKey() {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger released = new AtomicInteger();
        ResourceKey key = new ResourceKey(new ShapeOf(), List.of(2L, 3L), 3007);
        try (ExecutionContext context = new ExecutionContext()) {
            NativeHandle first = context.resource(key, () -> {
                created.incrementAndGet();
                return new NativeHandle(DESC, 1, address -> released.incrementAndGet());
            });
            NativeHandle second = context.resource(key, () -> {
                created.incrementAndGet();
                return new NativeHandle(DESC, 2, address -> released.incrementAndGet());
            });
            assertSame(first, second);
            assertEquals(1, context.resourceCount());
        }
        assertEquals(1, created.get());
        assertEquals(1, released.get());
    }

    @Test
    @DisplayName("a failing release function does not leak the remaining resources")
    void releasesEverythingDespiteFailures() {
        AtomicInteger released = new AtomicInteger();
        ExecutionContext context = new ExecutionContext();
        context.resource(new ResourceKey(new ShapeOf(), List.of(1L), 3007),
                () -> new NativeHandle(DESC, 1, address -> {
                    throw new IllegalStateException("boom");
                }));
        NativeHandle second = context.resource(new ResourceKey(new ShapeOf(), List.of(2L), 3007),
                () -> new NativeHandle(DESC, 2, address -> released.incrementAndGet()));
        context.resource(new ResourceKey(new ShapeOf(), List.of(3L), 3007),
                () -> new NativeHandle(DESC, 3, address -> {
                    throw new IllegalStateException("bang");
                }));

        IllegalStateException e = assertThrows(IllegalStateException.class, context::close);

        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("bang", e.getSuppressed()[0].getMessage());
        assertTrue(second.isReleased());
        assertEquals(1, released.get());
        assertTrue(context.isClosed());
        assertEquals(0, context.resourceCount());
    }

    @Test
    @DisplayName("keys from different backend versions never share a resource")
    void versionSeparatesKeys() {
        try (ExecutionContext context = new ExecutionContext()) {
            NativeHandle v1 = context.resource(new ResourceKey(new ShapeOf(), List.of(4L), 3007),
                    () -> new NativeHandle(DESC, 1, address -> { }));
            NativeHandle v2 = context.resource(new ResourceKey(new ShapeOf(), List.of(4L), 4000),
                    () -> new NativeHandle(DESC, 2, address -> { }));
            assertFalse(v1 == v2);
            assertEquals(2, context.resourceCount());
        }
    }

    @Test
    @DisplayName("a retained handle outlives the context")
    void retainedHandleOutlivesContext() {
        AtomicInteger released = new AtomicInteger();
        NativeHandle kept;
        try (ExecutionContext context = new ExecutionContext()) {
            kept = context.resource(new ResourceKey(new ShapeOf(), List.of(), 1),
                    () -> new NativeHandle(DESC, 9, address -> released.incrementAndGet())).retain();
        }
        assertEquals(0, released.get());
        assertTrue(kept.release());
        assertEquals(1, released.get());
    }

    @Test
    @DisplayName("close is idempotent and the context refuses further use")
    void closeIsIdempotent() {
        ExecutionContext context = new ExecutionContext();
        context.close();
        context.close();
        assertTrue(context.isClosed());
        assertThrows(IllegalStateException.class,
                () -> context.resource(new ResourceKey(new ShapeOf(), List.of(), 1),
                        () -> new NativeHandle(DESC, 1, address -> { })));
    }

    @Test
    @DisplayName("looks up registered services by type")
    void services() {
        try (ExecutionContext context = new ExecutionContext()) {
            context.register(CharSequence.class, "kernels");
            assertEquals("kernels", context.service(CharSequence.class));
            assertThrows(IllegalStateException.class, () -> context.service(Runnable.class));
        }
    }
}
