package com.example.shapes;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

public class Shapes {

    static final BiFunction<Integer, Integer, Point> CREATE = (x, y) -> new Point(x, y);

    static final BiFunction<Integer, Integer, Point> SWAPPED = (a, b) -> Point.of(b, a);

    private Point annotated;

    static Point make(int x, int y) {
        return new Point(x, y);
    }

    static List<Point> onAxis(List<Integer> xs) {
        return xs.stream().map(x -> new Point(x, 0)).collect(Collectors.toList());
    }

    static Function<Integer, Point> diagonal() {
        return d -> new Point(d, d);
    }

    static Class<?> pointType() {
        return Point.class;
    }

    static Class<?> intType() {
        return int.class;
    }

    Point shifted(Point p, int dx) {
        return new Point(p.x() + dx, p.y());
    }
}
