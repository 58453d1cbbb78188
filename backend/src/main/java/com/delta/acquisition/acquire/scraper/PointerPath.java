package com.delta.acquisition.acquire.scraper;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Intermediate pointer coordinates between two points, eased in and out with a small random wobble.
 * The last point is always the exact target.
 */
public final class PointerPath {
    static final double MAX_OFFSET_PX = 3.0;

    private PointerPath() {
    }

    public record Point(double x, double y) {
    }

    public static List<Point> between(double fromX, double fromY, double toX, double toY, int steps, Random random) {
        int count = Math.max(1, steps);
        List<Point> points = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            double t = (double) i / count;
            double eased = t * t * (3.0 - 2.0 * t);
            double x = fromX + (toX - fromX) * eased;
            double y = fromY + (toY - fromY) * eased;
            if (i < count) {
                x += (random.nextDouble() * 2.0 - 1.0) * MAX_OFFSET_PX;
                y += (random.nextDouble() * 2.0 - 1.0) * MAX_OFFSET_PX;
            }
            points.add(new Point(x, y));
        }
        return points;
    }
}
