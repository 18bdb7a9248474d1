package com.aml.network.api;

/**
 * Layout used to compute node positions in {@link VisualizationHints}.
 */
public enum LayoutAlgorithm {
    /** Rings around the center; better connected nodes sit farther out. */
    FORCE,
    /** Every node on one circle around the center. */
    CIRCULAR,
    /** One row per hop depth below the center. */
    HIERARCHICAL
}
