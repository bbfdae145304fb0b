package com.eainde.truckticket.ocr;

/**
 * Axis-aligned rectangle in page-normalized coordinates, (0,0) top-left and (1,1) bottom-right.
 */
public record BoundingBox(double x0, double y0, double x1, double y1) {

    private static final double EPS = 1e-6;

    public BoundingBox {
        if (x0 < -EPS || y0 < -EPS || x1 > 1 + EPS || y1 > 1 + EPS) {
            throw new IllegalArgumentException("Coordinates must be normalized to [0,1]: " + describe(x0, y0, x1, y1));
        }
        if (x1 < x0 || y1 < y0) {
            throw new IllegalArgumentException("Expected x0<=x1 and y0<=y1: " + describe(x0, y0, x1, y1));
        }
    }

    public static BoundingBox of(double x0, double y0, double x1, double y1) {
        return new BoundingBox(x0, y0, x1, y1);
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }

    public boolean contains(BoundingBox other) {
        return other.x0 >= x0 - EPS && other.y0 >= y0 - EPS
                && other.x1 <= x1 + EPS && other.y1 <= y1 + EPS;
    }

    public boolean overlapsHorizontally(BoundingBox other) {
        return other.x0 < x1 && other.x1 > x0;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(Math.min(x0, other.x0), Math.min(y0, other.y0),
                Math.max(x1, other.x1), Math.max(y1, other.y1));
    }

    /**
     * Maps this box from a page scanned with the given clockwise rotation back to upright
     * page coordinates.
     *
     * @param orientationDegrees 0, 90, 180 or 270
     */
    public BoundingBox toUpright(int orientationDegrees) {
        int turns = Math.floorMod(orientationDegrees, 360) / 90;
        BoundingBox b = this;
        for (int i = 0; i < turns; i++) {
            // (x, y) -> (y, 1 - x)
            b = new BoundingBox(clamp(b.y0), clamp(1 - b.x1), clamp(b.y1), clamp(1 - b.x0));
        }
        return b;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String describe(double x0, double y0, double x1, double y1) {
        return "[" + x0 + ", " + y0 + ", " + x1 + ", " + y1 + "]";
    }
}
