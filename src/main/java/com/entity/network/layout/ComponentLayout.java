package com.entity.network.layout;

/**
 * Local coordinates for one connected component, indexed like the component's member array.
 */
public record ComponentLayout(double[] x, double[] y, int iterations, boolean approximate, boolean truncated) {

    public static ComponentLayout single() {
        return new ComponentLayout(new double[]{0.0}, new double[]{0.0}, 0, false, false);
    }

    public int size() {
        return x.length;
    }
}
