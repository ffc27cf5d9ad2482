package com.entity.network.layout;

import java.util.List;

/**
 * Packs independently laid out components into shelves of non-overlapping boxes.
 * Boxes are placed in the given order, left to right, opening a new shelf when a
 * row is full. Each box is the component's bounding box grown by the padding, so
 * members of different components are always at least {@code padding} apart.
 */
final class ComponentPacker {

    private ComponentPacker() {
    }

    /**
     * @return per-component translation, {@code [dx, dy]}, centering the packed result on the origin
     */
    static double[][] pack(List<ComponentLayout> layouts, double padding) {
        int count = layouts.size();
        double[][] bounds = new double[count][4];
        double totalArea = 0.0;
        double widest = 0.0;
        for (int c = 0; c < count; c++) {
            ComponentLayout layout = layouts.get(c);
            double minX = Double.POSITIVE_INFINITY;
            double minY = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            double maxY = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < layout.size(); i++) {
                minX = Math.min(minX, layout.x()[i]);
                maxX = Math.max(maxX, layout.x()[i]);
                minY = Math.min(minY, layout.y()[i]);
                maxY = Math.max(maxY, layout.y()[i]);
            }
            bounds[c] = new double[]{minX, minY, maxX - minX + padding, maxY - minY + padding};
            totalArea += bounds[c][2] * bounds[c][3];
            widest = Math.max(widest, bounds[c][2]);
        }
        double rowWidth = Math.max(widest, Math.sqrt(totalArea));

        double[][] offsets = new double[count][2];
        double cursorX = 0.0;
        double cursorY = 0.0;
        double rowHeight = 0.0;
        double packedWidth = 0.0;
        for (int c = 0; c < count; c++) {
            double width = bounds[c][2];
            double height = bounds[c][3];
            if (cursorX > 0.0 && cursorX + width > rowWidth) {
                cursorX = 0.0;
                cursorY += rowHeight;
                rowHeight = 0.0;
            }
            offsets[c][0] = cursorX - bounds[c][0];
            offsets[c][1] = cursorY - bounds[c][1];
            cursorX += width;
            rowHeight = Math.max(rowHeight, height);
            packedWidth = Math.max(packedWidth, cursorX);
        }
        double packedHeight = cursorY + rowHeight;

        double shiftX = (packedWidth - padding) / 2.0;
        double shiftY = (packedHeight - padding) / 2.0;
        for (double[] offset : offsets) {
            offset[0] -= shiftX;
            offset[1] -= shiftY;
        }
        return offsets;
    }
}
