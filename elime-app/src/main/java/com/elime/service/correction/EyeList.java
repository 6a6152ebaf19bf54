package com.elime.service.correction;

import com.elime.model.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable list of eye points, always sorted ascending by x. Ties keep their
 * previous relative order.
 *
 * A list may start out with more than {@link #MAX_EYES} points when detection
 * found that many, but none of the operations here grows a list past that
 * limit.
 */
public final class EyeList {

    public static final int MAX_EYES = 2;

    private static final EyeList EMPTY = new EyeList(List.of());

    private final List<Point> points;

    private EyeList(List<Point> sortedPoints) {
        this.points = sortedPoints;
    }

    public static EyeList empty() {
        return EMPTY;
    }

    public static EyeList of(List<Point> points) {
        return sort(new ArrayList<>(points)).eyes();
    }

    public static EyeList of(Point... points) {
        return of(Arrays.asList(points));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Point get(int index) {
        return points.get(index);
    }

    public List<Point> points() {
        return points;
    }

    /**
     * Replaces the point at {@code index} and re-sorts.
     */
    public Change set(int index, Point point) {
        List<Point> copy = new ArrayList<>(points);
        copy.set(index, point);
        return sort(copy);
    }

    /**
     * Inserts a point at {@code index} and re-sorts. Indices in the returned
     * change refer to the list before the insertion; the inserted point is
     * tracked as {@link Change#inserted()}.
     */
    public Change insert(int index, Point point) {
        if (points.size() >= MAX_EYES) {
            throw new IllegalStateException("Already have " + points.size() + " eyes");
        }
        List<Point> copy = new ArrayList<>(points);
        copy.add(index, point);
        Change sorted = sort(copy);
        int[] oldToNew = new int[points.size()];
        for (int i = 0; i < oldToNew.length; i++) {
            oldToNew[i] = sorted.oldToNew[i < index ? i : i + 1];
        }
        return new Change(sorted.eyes, oldToNew, sorted.oldToNew[index]);
    }

    public EyeList remove(int index) {
        List<Point> copy = new ArrayList<>(points);
        copy.remove(index);
        return new EyeList(Collections.unmodifiableList(copy));
    }

    private static Change sort(List<Point> unsorted) {
        Integer[] order = new Integer[unsorted.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingInt(i -> unsorted.get(i).x()));

        List<Point> sorted = new ArrayList<>(unsorted.size());
        int[] oldToNew = new int[order.length];
        for (int newIndex = 0; newIndex < order.length; newIndex++) {
            sorted.add(unsorted.get(order[newIndex]));
            oldToNew[order[newIndex]] = newIndex;
        }
        return new Change(new EyeList(Collections.unmodifiableList(sorted)), oldToNew, -1);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof EyeList other && points.equals(other.points));
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return points.toString();
    }

    /**
     * Result of a mutation: the new list plus where each old index ended up.
     */
    public static final class Change {
        private final EyeList eyes;
        private final int[] oldToNew;
        private final int inserted;

        private Change(EyeList eyes, int[] oldToNew, int inserted) {
            this.eyes = eyes;
            this.oldToNew = oldToNew;
            this.inserted = inserted;
        }

        public EyeList eyes() {
            return eyes;
        }

        /**
         * New index of the point formerly at {@code oldIndex}; null stays null.
         */
        public Integer track(Integer oldIndex) {
            return oldIndex == null ? null : oldToNew[oldIndex];
        }

        /** New index of the inserted point, or -1 if nothing was inserted. */
        public int inserted() {
            return inserted;
        }
    }
}
