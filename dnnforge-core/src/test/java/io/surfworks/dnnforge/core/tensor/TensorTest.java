package io.surfworks.dnnforge.core.tensor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Tensor")
class TensorTest {

    private static Tensor matrix() {
        return Tensor.of(ScalarType.F64, new double[] {1, 2, 3, 4, 5, 6}, 2, 3);
    }

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("of() rejects data whose length does not match the shape")
        void rejectsWrongLength() {
            assertThrows(IllegalArgumentException.class,
                    () -> Tensor.of(ScalarType.F32, new double[] {1, 2, 3}, 2, 2));
        }

        @Test
        @DisplayName("values are coerced to the element type")
        void coercesToElementType() {
            Tensor t = Tensor.of(ScalarType.I32, new double[] {1.7, -2.2}, 2);
            assertArrayEquals(new double[] {1, -2}, t.toArray());
        }

        @Test
        @DisplayName("vector() builds an int64 shape vector")
        void vectorIsInt64() {
            Tensor v = Tensor.vector(4, 3, 3, 3);
            assertEquals(ScalarType.I64, v.dtype());
            assertArrayEquals(new long[] {4, 3, 3, 3}, v.toLongArray());
        }

        @Test
        @DisplayName("scalar has rank 0")
        void scalarHasRankZero() {
            Tensor s = Tensor.scalar(ScalarType.F64, 2.5);
            assertEquals(0, s.rank());
            assertEquals(2.5, s.scalarValue());
        }
    }

    @Nested
    @DisplayName("Views")
    class Views {

        @Test
        @DisplayName("permute swaps axes without copying")
        void permuteSwapsAxes() {
            Tensor t = matrix();
            Tensor p = t.permute(1, 0);
            assertArrayEquals(new int[] {3, 2}, p.shape());
            assertEquals(4, p.get(0, 1));
            assertFalse(p.isContiguous());
            p.set(40, 0, 1);
            assertEquals(40, t.get(1, 0));
        }

        @Test
        @DisplayName("flip reverses an axis")
        void flipReversesAxis() {
            Tensor f = matrix().flip(1);
            assertArrayEquals(new double[] {3, 2, 1, 6, 5, 4}, f.toArray());
        }

        @Test
        @DisplayName("dimShuffle inserts and drops broadcastable axes")
        void dimShuffleInsertsAxes() {
            Tensor t = matrix();
            Tensor expanded = t.dimShuffle(List.of(0, 1, -1, -1));
            assertArrayEquals(new int[] {2, 3, 1, 1}, expanded.shape());
            assertEquals(6, expanded.get(1, 2, 0, 0));
            Tensor back = expanded.dimShuffle(List.of(0, 1));
            assertArrayEquals(t.toArray(), back.toArray());
        }

        @Test
        @DisplayName("dimShuffle refuses to drop an axis larger than one")
        void dimShuffleRefusesToDrop() {
            assertThrows(IllegalArgumentException.class, () -> matrix().dimShuffle(List.of(0)));
        }

        @Test
        @DisplayName("contiguous returns the same tensor when already contiguous")
        void contiguousIsIdentityWhenContiguous() {
            Tensor t = matrix();
            assertSame(t, t.contiguous());
            Tensor c = t.permute(1, 0).contiguous();
            assertNotSame(t, c);
            assertTrue(c.isContiguous());
            assertArrayEquals(new double[] {1, 4, 2, 5, 3, 6}, c.toArray());
        }
    }

    @Nested
    @DisplayName("forEachIndex")
    class Iteration {

        @Test
        @DisplayName("visits indices in row-major order")
        void rowMajorOrder() {
            List<String> seen = new ArrayList<>();
            Tensor.forEachIndex(new int[] {2, 2}, idx -> seen.add(idx[0] + "," + idx[1]));
            assertEquals(List.of("0,0", "0,1", "1,0", "1,1"), seen);
        }

        @Test
        @DisplayName("visits a rank-0 shape once and an empty shape never")
        void edgeShapes() {
            int[] count = {0};
            Tensor.forEachIndex(new int[0], idx -> count[0]++);
            assertEquals(1, count[0]);
            Tensor.forEachIndex(new int[] {3, 0}, idx -> count[0]++);
            assertEquals(1, count[0]);
        }
    }
}
