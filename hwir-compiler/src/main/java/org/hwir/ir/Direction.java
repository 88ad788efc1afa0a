package org.hwir.ir;

/** Direction of a module port. */
public enum Direction {
    INPUT("input"),
    OUTPUT("output");

    public final String text;

    Direction(String text) {
        this.text = text;
    }

    public static Direction fromText(String text) {
        for (Direction direction: Direction.values())
            if (direction.text.equals(text))
                return direction;
        throw new IllegalArgumentException("Unknown port direction " + text);
    }

    @Override
    public String toString() {
        return this.text;
    }
}
