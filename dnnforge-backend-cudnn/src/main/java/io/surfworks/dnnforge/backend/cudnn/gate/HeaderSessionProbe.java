package io.surfworks.dnnforge.backend.cudnn.gate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import io.surfworks.dnnforge.backend.cudnn.config.DnnConfig;

/**
 * Reads the header version from {@code CUDNN_MAJOR}, {@code CUDNN_MINOR} and
 * {@code CUDNN_PATCHLEVEL} and the library version from the versioned
 * {@code libcudnn.so.X.Y.Z} file name.
 *
 * <p>Versions are encoded as {@code major * 1000 + minor * 100 + patch}.
 */
public final class HeaderSessionProbe implements SessionProbe {

    private static final Pattern DEFINE = Pattern.compile("^\\s*#define\\s+(CUDNN_MAJOR|CUDNN_MINOR|CUDNN_PATCHLEVEL)\\s+(\\d+)");
    private static final Pattern LIBRARY = Pattern.compile("libcudnn\\.so\\.(\\d+)\\.(\\d+)\\.(\\d+)");

    @Override
    public BackendVersions open(DnnConfig config) throws IOException {
        return new BackendVersions(headerVersion(config.includePath()), libraryVersion(config.libraryPath()));
    }

    static int headerVersion(Path includeDir) throws IOException {
        // Newer releases moved the version macros out of cudnn.h
        Path header = includeDir.resolve("cudnn_version.h");
        if (!Files.exists(header)) {
            header = includeDir.resolve("cudnn.h");
        }
        if (!Files.exists(header)) {
            throw new IOException("No cudnn.h in " + includeDir);
        }
        Map<String, Integer> defines = new HashMap<>();
        for (String line : Files.readAllLines(header)) {
            Matcher m = DEFINE.matcher(line);
            if (m.find()) {
                defines.put(m.group(1), Integer.parseInt(m.group(2)));
            }
        }
        if (!defines.containsKey("CUDNN_MAJOR") || !defines.containsKey("CUDNN_MINOR")) {
            throw new IOException(header + " does not define CUDNN_MAJOR and CUDNN_MINOR");
        }
        return encode(defines.get("CUDNN_MAJOR"), defines.get("CUDNN_MINOR"),
                defines.getOrDefault("CUDNN_PATCHLEVEL", 0));
    }

    static int libraryVersion(Path libraryDir) throws IOException {
        if (!Files.isDirectory(libraryDir)) {
            throw new IOException("Library directory " + libraryDir + " does not exist");
        }
        int best = -1;
        try (Stream<Path> files = Files.list(libraryDir)) {
            for (Path file : files.toList()) {
                Matcher m = LIBRARY.matcher(file.getFileName().toString());
                if (m.matches()) {
                    best = Math.max(best, encode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                            Integer.parseInt(m.group(3))));
                }
            }
        }
        if (best < 0) {
            throw new IOException("No versioned libcudnn.so in " + libraryDir);
        }
        return best;
    }

    static int encode(int major, int minor, int patch) {
        return major * 1000 + minor * 100 + patch;
    }
}
