package io.surfworks.dnnforge.backend.cudnn.gate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * A device compute capability such as 3.5 or 8.6.
 */
public record ComputeCapability(int major, int minor) implements Comparable<ComputeCapability> {

    private static final Pattern SM = Pattern.compile("sm_(\\d+)(\\d)");
    private static final Pattern DOTTED = Pattern.compile("(\\d+)\\.(\\d+)");

    /**
     * Parses {@code sm_35} or {@code 3.5}.
     *
     * @throws ConfigurationException if the text is in neither form
     */
    public static ComputeCapability parse(String text) {
        String s = text == null ? "" : text.trim();
        Matcher m = SM.matcher(s);
        if (!m.matches()) {
            m = DOTTED.matcher(s);
        }
        if (!m.matches()) {
            throw new ConfigurationException("Unrecognized compute capability '" + text
                    + "': expected sm_XY or X.Y");
        }
        return new ComputeCapability(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    public boolean isAtLeast(ComputeCapability other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(ComputeCapability other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
