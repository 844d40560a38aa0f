package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Convolution padding policy: "valid" (no padding), "full" (kernel size minus
 * one on each side), a single pad used for every spatial axis, or one pad per
 * spatial axis.
 */
public record BorderMode(Kind kind, List<Integer> pads) {

    public enum Kind {
        VALID,
        FULL,
        UNIFORM,
        EXPLICIT
    }

    public static final BorderMode VALID = new BorderMode(Kind.VALID, List.of());
    public static final BorderMode FULL = new BorderMode(Kind.FULL, List.of());

    public BorderMode {
        pads = List.copyOf(pads);
        if (kind == Kind.UNIFORM && pads.size() != 1) {
            throw new ConfigurationException("Uniform border mode takes exactly one pad, got " + pads);
        }
        for (int pad : pads) {
            if (pad < 0) {
                throw new ConfigurationException("Border mode pads must be >= 0, got " + pads);
            }
        }
    }

    public static BorderMode uniform(int pad) {
        return new BorderMode(Kind.UNIFORM, List.of(pad));
    }

    public static BorderMode explicit(int... pads) {
        List<Integer> list = new ArrayList<>(pads.length);
        for (int pad : pads) {
            list.add(pad);
        }
        return new BorderMode(Kind.EXPLICIT, list);
    }

    /**
     * Parses "valid", "full", an integer, or a parenthesized tuple such as "(1, 2)".
     */
    public static BorderMode parse(String text) {
        String s = text.trim();
        if (s.equals("valid")) {
            return VALID;
        }
        if (s.equals("full")) {
            return FULL;
        }
        try {
            if (s.startsWith("(") || s.startsWith("[")) {
                char close = s.charAt(0) == '(' ? ')' : ']';
                if (s.length() < 2 || s.charAt(s.length() - 1) != close) {
                    throw new ConfigurationException("Invalid border mode '" + text + "': unclosed tuple");
                }
                String body = s.substring(1, s.length() - 1).trim();
                if (body.isEmpty()) {
                    return explicit();
                }
                String[] parts = body.split(",");
                List<Integer> pads = new ArrayList<>();
                for (String part : parts) {
                    if (!part.isBlank()) {
                        pads.add(Integer.parseInt(part.trim()));
                    }
                }
                return new BorderMode(Kind.EXPLICIT, pads);
            }
            return uniform(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Invalid border mode '" + text + "': expected 'valid', 'full', an integer or a tuple", e);
        }
    }

    /**
     * Expands a uniform pad to {@code spatialRank} entries; other kinds are returned as is.
     */
    public BorderMode expandTo(int spatialRank) {
        if (kind == Kind.UNIFORM) {
            return new BorderMode(Kind.EXPLICIT, Collections.nCopies(spatialRank, pads.get(0)));
        }
        return this;
    }

    /**
     * Resolves the concrete pad per spatial axis for the given kernel spatial sizes.
     */
    public int[] resolve(int[] kernelSpatial) {
        int[] result = new int[kernelSpatial.length];
        for (int i = 0; i < kernelSpatial.length; i++) {
            result[i] = switch (kind) {
                case VALID -> 0;
                case FULL -> kernelSpatial[i] - 1;
                case UNIFORM -> pads.get(0);
                case EXPLICIT -> pads.get(i);
            };
        }
        return result;
    }

    public boolean isValid() {
        return kind == Kind.VALID;
    }

    public boolean isFull() {
        return kind == Kind.FULL;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VALID -> "valid";
            case FULL -> "full";
            case UNIFORM -> String.valueOf(pads.get(0));
            case EXPLICIT -> pads.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
        };
    }
}
