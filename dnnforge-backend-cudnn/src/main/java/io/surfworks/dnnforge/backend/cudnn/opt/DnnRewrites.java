package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolution;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradInputs;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradWeights;
import io.surfworks.dnnforge.core.rewrite.RuleRegistry;

/**
 * Registers the accelerated rewrites.
 *
 * <table>
 *   <caption>Passes, in the order the driver runs them</caption>
 *   <tr><th>Pass</th><th>Priority</th><th>Contents</th></tr>
 *   <tr><td>{@code cudnn_check}</td><td>0</td><td>hard failure when requested but unavailable</td></tr>
 *   <tr><td>{@code conv_meta}</td><td>10, 25</td><td>cost-chosen lowering, opposite lowering</td></tr>
 *   <tr><td>{@code cudnn}</td><td>20, 30, 40</td><td>lifts, α/β merges, log-softmax fusion</td></tr>
 *   <tr><td>{@code inplace}</td><td>70</td><td>in-place output buffers</td></tr>
 * </table>
 *
 * <p>Example:
 * <pre>{@code
 * RuleRegistry registry = DnnRewrites.registerAll(new RuleRegistry(), runtime);
 * RewriteDriver.optimize(graph, registry, Set.of("fast_run"));
 * }</pre>
 */
public final class DnnRewrites {

    public static final String CHECK_PASS = "cudnn_check";
    public static final String META_PASS = "conv_meta";
    public static final String LIFT_PASS = "cudnn";
    public static final String INPLACE_PASS = "inplace";

    public static final int CHECK_PRIORITY = 0;
    public static final int META_PRIORITY = 10;
    public static final int LIFT_PRIORITY = 20;
    public static final int ALTERNATIVE_PRIORITY = 25;
    public static final int MERGE_PRIORITY = 30;
    public static final int FUSION_PRIORITY = 40;
    public static final int INPLACE_PRIORITY = 70;

    private static final Set<String> CUDNN = Set.of("cudnn");
    private static final Set<String> FAST_RUN = Set.of("fast_run", "cudnn");
    private static final Set<String> INPLACE = Set.of("fast_run", "inplace", "cudnn");

    private DnnRewrites() {
    }

    public static RuleRegistry registerAll(RuleRegistry registry, DnnRuntime runtime) {
        return registerAll(registry, runtime, new StaticCostOracle());
    }

    /**
     * Registers every rewrite, with {@code oracle} deciding between convolution lowerings.
     */
    public static RuleRegistry registerAll(RuleRegistry registry, DnnRuntime runtime, CostOracle oracle) {
        registry.register(CHECK_PASS, CHECK_PRIORITY, CUDNN, new RequireDnnAvailable(runtime));

        registry.register(META_PASS, META_PRIORITY, Set.of("conv_meta"), new MetaConvolutionRule(runtime, oracle));
        registry.register(META_PASS, ALTERNATIVE_PRIORITY, Set.of("conv_dnn_alternative"),
                new LiftConvolutionAlternative(runtime));

        registry.register(LIFT_PASS, LIFT_PRIORITY, Set.of("conv_dnn", "fast_compile", "fast_run", "cudnn"),
                new LiftConvolution(runtime));
        registry.register(LIFT_PASS, LIFT_PRIORITY, FAST_RUN, new LiftPooling(runtime));
        registry.register(LIFT_PASS, LIFT_PRIORITY, FAST_RUN, new LiftPoolingGrad(runtime));
        registry.register(LIFT_PASS, LIFT_PRIORITY, FAST_RUN, new LiftSoftmax(runtime));
        registry.register(LIFT_PASS, LIFT_PRIORITY, FAST_RUN, new LiftSoftmaxGrad(runtime));

        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new AlphaMerge(runtime, "local_dnn_conv_alpha_merge", DnnConvolution.KIND));
        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new AlphaMerge(runtime, "local_dnn_convw_alpha_merge", DnnConvolutionGradWeights.KIND));
        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new AlphaMerge(runtime, "local_dnn_convi_alpha_merge", DnnConvolutionGradInputs.KIND));
        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new OutputMerge(runtime, "local_dnn_conv_output_merge", DnnConvolution.KIND));
        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new OutputMerge(runtime, "local_dnn_convw_output_merge", DnnConvolutionGradWeights.KIND));
        registry.register(LIFT_PASS, MERGE_PRIORITY, FAST_RUN,
                new OutputMerge(runtime, "local_dnn_convi_output_merge", DnnConvolutionGradInputs.KIND));

        registry.register(LIFT_PASS, FUSION_PRIORITY, FAST_RUN, new LogSoftmaxFusion(runtime));

        registry.register(INPLACE_PASS, INPLACE_PRIORITY, INPLACE,
                new InplaceConvolution(runtime, "local_dnn_conv_inplace", DnnConvolution.KIND));
        registry.register(INPLACE_PASS, INPLACE_PRIORITY, INPLACE,
                new InplaceConvolution(runtime, "local_dnn_convgw_inplace", DnnConvolutionGradWeights.KIND));
        registry.register(INPLACE_PASS, INPLACE_PRIORITY, INPLACE,
                new InplaceConvolution(runtime, "local_dnn_convgi_inplace", DnnConvolutionGradInputs.KIND));
        return registry;
    }
}
