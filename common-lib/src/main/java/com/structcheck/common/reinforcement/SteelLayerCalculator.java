package com.structcheck.common.reinforcement;

import com.structcheck.common.model.SteelLayer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the discrete steel layers a section contributes to strain-compatibility
 * analysis. Positions are measured from the compression face and returned sorted.
 *
 * <p>Stateless. Layers are built once per reinforcement configuration and only read
 * afterwards.
 */
public final class SteelLayerCalculator {

    private SteelLayerCalculator() {}

    /** Half of {@code asTotal} at {@code cover}, half at {@code depth − cover}. */
    public static List<SteelLayer> twoLayer(double depth, double cover, double asTotal) {
        return List.of(
            new SteelLayer(cover, asTotal / 2),
            new SteelLayer(depth - cover, asTotal / 2)
        );
    }

    /**
     * Column-type layout: {@code nLayers} rows evenly spaced between cover and
     * {@code dimension − cover}, each with {@code barsPerLayer} bars.
     *
     * <p>One layer of one bar is placed at mid-depth (single central bar). Any other
     * arrangement with fewer than two layers yields no layers.
     */
    public static List<SteelLayer> columnLayers(double dimension, double cover,
                                                int nLayers, int barsPerLayer, double barArea) {
        if (nLayers == 1 && barsPerLayer == 1) {
            return List.of(new SteelLayer(dimension / 2, barArea));
        }
        if (nLayers < 2) {
            return List.of();
        }

        double first = cover;
        double last = dimension - cover;
        double spacing = (last - first) / (nLayers - 1);

        List<SteelLayer> layers = new ArrayList<>(nLayers);
        for (int i = 0; i < nLayers; i++) {
            double position = nLayers == 2 ? (i == 0 ? first : last) : first + i * spacing;
            layers.add(new SteelLayer(position, barsPerLayer * barArea));
        }
        return List.copyOf(layers);
    }

    /**
     * Wall layout along the wall length: a layer of edge bars at each end plus
     * distributed mesh layers at {@code spacing} in between.
     *
     * @param length       wall length in the bending direction (mm)
     * @param cover        cover to the bar centre (mm)
     * @param nMeshes      number of curtains (1 or 2); bars per mesh layer
     * @param edgeBarArea  area of one edge bar (mm²)
     * @param nEdgeBars    edge bars at each end
     * @param meshBarArea  area of one mesh bar (mm²)
     * @param spacing      mesh spacing along the length (mm)
     */
    public static List<SteelLayer> wallLayers(double length, double cover, int nMeshes,
                                              double edgeBarArea, int nEdgeBars,
                                              double meshBarArea, double spacing) {
        double first = cover;
        double last = length - cover;
        List<SteelLayer> layers = new ArrayList<>();
        layers.add(new SteelLayer(first, nEdgeBars * edgeBarArea));

        if (spacing > 0 && last > first) {
            int intervals = (int) Math.ceil((last - first) / spacing);
            double actualSpacing = (last - first) / intervals;
            for (int i = 1; i < intervals; i++) {
                layers.add(new SteelLayer(first + i * actualSpacing, nMeshes * meshBarArea));
            }
        }

        layers.add(new SteelLayer(last, nEdgeBars * edgeBarArea));
        layers.sort(Comparator.comparingDouble(SteelLayer::position));
        return List.copyOf(layers);
    }

    public static double totalArea(List<SteelLayer> layers) {
        return layers.stream().mapToDouble(SteelLayer::area).sum();
    }
}
