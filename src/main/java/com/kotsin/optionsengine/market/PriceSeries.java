package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.model.PricePoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only price history of one (index, channel). Each call is atomic on its own;
 * readers get copies of bounded suffixes.
 */
public class PriceSeries {

    private final List<PricePoint> points = new ArrayList<>();
    private final int maxPoints;

    public PriceSeries(int maxPoints) {
        this.maxPoints = maxPoints;
    }

    synchronized void append(PricePoint point) {
        points.add(point);
        if (maxPoints > 0 && points.size() > maxPoints) {
            points.subList(0, points.size() - maxPoints).clear();
        }
    }

    public synchronized int size() {
        return points.size();
    }

    public synchronized PricePoint last() {
        return points.isEmpty() ? null : points.get(points.size() - 1);
    }

    /** Last {@code n} prices, oldest first. */
    public synchronized double[] prices(int n) {
        int from = Math.max(0, points.size() - n);
        double[] out = new double[points.size() - from];
        for (int i = from; i < points.size(); i++) {
            out[i - from] = points.get(i).price();
        }
        return out;
    }

    /** Last {@code n} volumes aligned with {@link #prices(int)}. */
    public synchronized double[] volumes(int n) {
        int from = Math.max(0, points.size() - n);
        double[] out = new double[points.size() - from];
        for (int i = from; i < points.size(); i++) {
            out[i - from] = points.get(i).volume();
        }
        return out;
    }

    public synchronized long totalVolume() {
        long total = 0;
        for (PricePoint point : points) {
            total += point.volume();
        }
        return total;
    }
}
