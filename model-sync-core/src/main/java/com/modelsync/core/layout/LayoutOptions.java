package com.modelsync.core.layout;

import com.modelsync.core.config.ModelSyncConfig;

import java.util.Objects;

/**
 * Parameters of a layout run.
 *
 * @param algorithm algorithm to run
 * @param nodeSpacing horizontal gap between nodes
 * @param layerSpacing vertical gap between tree layers
 * @param padding distance of the layout from the origin
 * @param iterations force-directed iteration count
 * @param seed seed for force-directed initial placement
 */
public record LayoutOptions(
    LayoutAlgorithm algorithm,
    double nodeSpacing,
    double layerSpacing,
    double padding,
    int iterations,
    long seed
) {
    public LayoutOptions {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        if (nodeSpacing < 0 || layerSpacing < 0 || padding < 0) {
            throw new IllegalArgumentException("Spacing and padding must not be negative");
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must not be negative: " + iterations);
        }
    }

    public static LayoutOptions defaults() {
        return from(ModelSyncConfig.LayoutSettings.defaults());
    }

    public static LayoutOptions from(ModelSyncConfig.LayoutSettings settings) {
        return new LayoutOptions(
            LayoutAlgorithm.fromName(settings.algorithm()),
            settings.nodeSpacing(),
            settings.layerSpacing(),
            settings.padding(),
            settings.iterations(),
            settings.seed());
    }

    public LayoutOptions withAlgorithm(LayoutAlgorithm newAlgorithm) {
        return new LayoutOptions(newAlgorithm, nodeSpacing, layerSpacing, padding, iterations, seed);
    }
}
