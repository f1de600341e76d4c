package com.lynkvertx.vzev.model;

/**
 * Energy a {@link FeeType#PER_KWH} fee is charged on.
 */
public enum FeeBasis {
    LOCAL,
    GRID
}
