/*
 * Copyright 2021 IBM Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy
 * of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.ibm.watson.replica.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Timestamped samples of named metrics, kept locally until they are
 * aggregated over a look-back window. Samples older than the window which is
 * read are discarded.
 */
public class InMemoryMetricsStore {

    private static final class Point {
        final long timestampMillis;
        final double value;

        Point(long timestampMillis, double value) {
            this.timestampMillis = timestampMillis;
            this.value = value;
        }
    }

    private final Map<String, Deque<Point>> data = new HashMap<>();

    public synchronized void addMetricsPoint(Map<String, Double> points, long timestampMillis) {
        for (Map.Entry<String, Double> ent : points.entrySet()) {
            data.computeIfAbsent(ent.getKey(), k -> new ArrayDeque<>())
                    .addLast(new Point(timestampMillis, ent.getValue()));
        }
    }

    /**
     * @return average of the samples taken at or after {@code sinceMillis}, or null if there are none
     */
    public synchronized Double windowAverage(String key, long sinceMillis) {
        Deque<Point> points = prune(key, sinceMillis);
        if (points == null) {
            return null;
        }
        double sum = 0.0;
        for (Point p : points) {
            sum += p.value;
        }
        return sum / points.size();
    }

    /**
     * @return maximum of the samples taken at or after {@code sinceMillis}, or null if there are none
     */
    public synchronized Double maxValue(String key, long sinceMillis) {
        Deque<Point> points = prune(key, sinceMillis);
        if (points == null) {
            return null;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            max = Math.max(max, p.value);
        }
        return max;
    }

    private Deque<Point> prune(String key, long sinceMillis) {
        Deque<Point> points = data.get(key);
        if (points == null) {
            return null;
        }
        while (!points.isEmpty() && points.peekFirst().timestampMillis < sinceMillis) {
            points.removeFirst();
        }
        return points.isEmpty() ? null : points;
    }
}
