package io.surfworks.dnnforge.backend.cudnn;

import io.surfworks.dnnforge.backend.cudnn.config.DnnConfig;
import io.surfworks.dnnforge.backend.cudnn.gate.AvailabilityGate;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.backend.cudnn.ops.AlgorithmCache;
import io.surfworks.dnnforge.core.exec.ExecutionContext;

/**
 * The backend state every operator factory, rewrite rule and execution
 * consults: configuration, the availability gate and the algorithm cache.
 *
 * <p>Built once at startup and passed explicitly; there is no process-wide instance.
 *
 * <p>Example:
 * <pre>{@code
 * DnnRuntime runtime = DnnRuntime.forHost(DnnConfigLoader.load());
 * if (runtime.isAvailable()) {
 *     Value y = Dnn.convolution(runtime, img, kerns);
 * }
 * }</pre>
 */
public final class DnnRuntime {

    private final DnnConfig config;
    private final AvailabilityGate gate;
    private final AlgorithmCache algorithms = new AlgorithmCache();

    public DnnRuntime(DnnConfig config, AvailabilityGate gate) {
        this.config = config;
        this.gate = gate;
    }

    public static DnnRuntime forHost(DnnConfig config) {
        return new DnnRuntime(config, AvailabilityGate.forHost(config));
    }

    public DnnConfig config() {
        return config;
    }

    public AvailabilityGate gate() {
        return gate;
    }

    public AlgorithmCache algorithms() {
        return algorithms;
    }

    public boolean isAvailable() {
        return gate.isAvailable();
    }

    /**
     * @throws BackendUnavailableException if the backend is unavailable
     */
    public int version() {
        return gate.version();
    }

    public boolean supports(DnnFeature feature) {
        return gate.supports(feature);
    }

    /**
     * @throws BackendUnavailableException if the backend is unavailable
     * @throws FeatureUnsupportedException if the detected version predates {@code feature}
     */
    public void require(DnnFeature feature) {
        gate.require(feature);
    }

    /**
     * @throws BackendUnavailableException if the backend is unavailable
     */
    public void requireAvailable() {
        gate.requireAvailable();
    }

    /**
     * A fresh execution context with this runtime, {@code kernels} and the
     * shared algorithm cache registered.
     */
    public ExecutionContext newExecutionContext(DnnKernels kernels) {
        return new ExecutionContext()
                .register(DnnRuntime.class, this)
                .register(DnnKernels.class, kernels)
                .register(AlgorithmCache.class, algorithms);
    }
}
