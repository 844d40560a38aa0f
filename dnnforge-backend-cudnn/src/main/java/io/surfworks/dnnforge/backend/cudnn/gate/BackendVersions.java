package io.surfworks.dnnforge.backend.cudnn.gate;

/**
 * Versions reported by the header the code compiles against and by the library it loads.
 */
public record BackendVersions(int headerVersion, int libraryVersion) {

    public boolean isConsistent() {
        return headerVersion == libraryVersion;
    }
}
