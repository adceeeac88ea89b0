package com.example.shapes;

public class Point {

    private final int x;
    private final int y;

    public Point(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static Point of(int x, int y) {
        return new Point(x, y);
    }

    public static Point origin() {
        return new Point(0, 0);
    }

    public static Point copyOf(Point p) {
        return new Point(p.x(), p.y());
    }

    public Point translate(int dx, int dy) {
        return new Point(x + dx, y + dy);
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }
}
