package com.modelsync.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration of the synchronization engine.
 *
 * <p>Loaded from {@code model-sync.yaml}. Every section and value is optional; absent
 * entries take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * sync:
 *   textDebounceMs: 100
 *   editBatchDebounceMs: 50
 *   validateEdits: true
 *
 * layout:
 *   algorithm: tree
 *   nodeSpacing: 50
 *   layerSpacing: 100
 *   padding: 20
 *   iterations: 50
 *   seed: 42
 *   autoLayout: true
 *
 * ports:
 *   size: 10
 * }</pre>
 *
 * @param sync synchronization settings
 * @param layout layout settings
 * @param ports port settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelSyncConfig(
    @JsonProperty("sync") SyncSettings sync,
    @JsonProperty("layout") LayoutSettings layout,
    @JsonProperty("ports") PortSettings ports
) {
    public ModelSyncConfig {
        sync = sync != null ? sync : SyncSettings.defaults();
        layout = layout != null ? layout : LayoutSettings.defaults();
        ports = ports != null ? ports : PortSettings.defaults();
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ModelSyncConfig defaults() {
        return new ModelSyncConfig(null, null, null);
    }

    /**
     * Debounce and validation settings for both synchronization directions.
     *
     * @param textDebounceMs idle window before a changed document is reconverted
     * @param editBatchDebounceMs idle window before pending text edits are flushed, 0 flushes immediately
     * @param validateEdits whether edit ranges are validated before they are applied
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SyncSettings(
        @JsonProperty("textDebounceMs") Long textDebounceMs,
        @JsonProperty("editBatchDebounceMs") Long editBatchDebounceMs,
        @JsonProperty("validateEdits") Boolean validateEdits
    ) {
        public SyncSettings {
            textDebounceMs = textDebounceMs != null ? Math.max(0, textDebounceMs) : 100L;
            editBatchDebounceMs = editBatchDebounceMs != null ? Math.max(0, editBatchDebounceMs) : 50L;
            validateEdits = validateEdits == null || validateEdits;
        }

        public static SyncSettings defaults() {
            return new SyncSettings(null, null, null);
        }
    }

    /**
     * Layout engine settings.
     *
     * @param algorithm default algorithm name: grid, tree, layered or force
     * @param nodeSpacing horizontal gap between nodes
     * @param layerSpacing vertical gap between tree layers
     * @param padding distance of the layout from the origin
     * @param iterations force-directed iteration count
     * @param seed seed for force-directed initial placement
     * @param autoLayout whether a loaded model without stored positions is laid out
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LayoutSettings(
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("nodeSpacing") Double nodeSpacing,
        @JsonProperty("layerSpacing") Double layerSpacing,
        @JsonProperty("padding") Double padding,
        @JsonProperty("iterations") Integer iterations,
        @JsonProperty("seed") Long seed,
        @JsonProperty("autoLayout") Boolean autoLayout
    ) {
        public LayoutSettings {
            algorithm = algorithm != null ? algorithm : "grid";
            nodeSpacing = nodeSpacing != null ? nodeSpacing : 50.0;
            layerSpacing = layerSpacing != null ? layerSpacing : 100.0;
            padding = padding != null ? padding : 20.0;
            iterations = iterations != null ? iterations : 50;
            seed = seed != null ? seed : 42L;
            autoLayout = autoLayout == null || autoLayout;
        }

        public static LayoutSettings defaults() {
            return new LayoutSettings(null, null, null, null, null, null, null);
        }
    }

    /**
     * Port rendering settings.
     *
     * @param size port diameter
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PortSettings(
        @JsonProperty("size") Double size
    ) {
        public PortSettings {
            size = size != null && size > 0 ? size : 10.0;
        }

        public static PortSettings defaults() {
            return new PortSettings(null);
        }
    }
}
