package com.gdin.inspection.waterleak.util;

import com.gdin.inspection.waterleak.models.Coordinate;

import java.util.List;

public final class GeometryUtil {
    private GeometryUtil() {}

    /**
     * 点到折线的最短欧氏距离。折线只有一个点时退化为点距离，空折线返回 +Infinity。
     */
    public static double distanceToPolyline(Coordinate p, List<Coordinate> polyline) {
        if (polyline == null || polyline.isEmpty()) return Double.POSITIVE_INFINITY;
        if (polyline.size() == 1) return p.distanceTo(polyline.get(0));

        double best = Double.POSITIVE_INFINITY;
        for (int i = 1; i < polyline.size(); i++) {
            best = Math.min(best, distanceToSegment(p, polyline.get(i - 1), polyline.get(i)));
        }
        return best;
    }

    public static double distanceToSegment(Coordinate p, Coordinate a, Coordinate b) {
        double dr = b.getRow() - a.getRow();
        double dc = b.getCol() - a.getCol();
        double lengthSq = dr * dr + dc * dc;
        if (lengthSq == 0) return p.distanceTo(a);

        double t = ((p.getRow() - a.getRow()) * dr + (p.getCol() - a.getCol()) * dc) / lengthSq;
        t = Math.max(0.0, Math.min(1.0, t));
        return Math.hypot(p.getRow() - (a.getRow() + t * dr), p.getCol() - (a.getCol() + t * dc));
    }
}
