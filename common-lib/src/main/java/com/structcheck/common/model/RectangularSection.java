package com.structcheck.common.model;

import java.util.List;

/**
 * Rectangular reinforced-concrete section bent about one axis.
 *
 * <p>Value object: two sections with the same dimensions, materials and layers are
 * equal, which is what makes it usable as a cache key for derived curves.
 *
 * @param width  b, dimension perpendicular to the bending direction (mm)
 * @param depth  h, dimension along the bending direction (mm)
 * @param fc     concrete compressive strength f'c (MPa)
 * @param fy     steel yield strength (MPa)
 * @param layers reinforcement layers, positions measured from the compression face
 */
public record RectangularSection(
    double width,
    double depth,
    double fc,
    double fy,
    List<SteelLayer> layers
) {
    public RectangularSection {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    /**
     * Default two-layer idealization: half of {@code asTotal} at {@code cover} and
     * half at {@code depth − cover}.
     */
    public static RectangularSection twoLayer(double width, double depth, double fc, double fy,
                                              double asTotal, double cover) {
        return new RectangularSection(width, depth, fc, fy, List.of(
            new SteelLayer(cover, asTotal / 2),
            new SteelLayer(depth - cover, asTotal / 2)
        ));
    }

    public double grossArea() {
        return width * depth;
    }

    public double totalSteelArea() {
        return layers.stream().mapToDouble(SteelLayer::area).sum();
    }

    /** Same section with a different layer arrangement (reinforcement change). */
    public RectangularSection withLayers(List<SteelLayer> newLayers) {
        return new RectangularSection(width, depth, fc, fy, newLayers);
    }
}
