package work.geodsl.algorithm;

import work.geodsl.runtime.AlgorithmRegistry;

/**
 * Shared algorithm bootstrap so the kernel, the batch runner and tests bind the same set.
 */
public final class StandardAlgorithms {
    private StandardAlgorithms() {}

    public static AlgorithmRegistry create() {
        var registry = new AlgorithmRegistry();
        GeometryAlgorithms.register(registry);
        AlgebraAlgorithms.register(registry);
        StatisticsAlgorithms.register(registry);
        TransformationAlgorithms.register(registry);
        ListAlgorithms.register(registry);
        return registry;
    }
}
