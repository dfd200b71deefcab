package io.imagexform.core.fixture;

import java.util.ArrayList;
import java.util.List;

/** In-memory stand-in for an engine image: a size plus the operations applied to it. */
public final class Canvas {

    private final int width;
    private final int height;
    private final List<String> history;

    public Canvas(int width, int height) {
        this(width, height, List.of());
    }

    private Canvas(int width, int height, List<String> history) {
        this.width = width;
        this.height = height;
        this.history = List.copyOf(history);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public List<String> history() {
        return history;
    }

    public Canvas resized(int newWidth, int newHeight, String step) {
        return new Canvas(newWidth, newHeight, append(step));
    }

    public Canvas with(String step) {
        return new Canvas(width, height, append(step));
    }

    /** Text form written by {@link CanvasAdapter#save}: {@code WxH step1,step2}. */
    public String serialize() {
        return width + "x" + height + " " + String.join(",", history);
    }

    /** Parses {@code WxH} (optionally followed by a history) as written by {@link #serialize}. */
    public static Canvas parse(String text) {
        String[] parts = text.trim().split(" ", 2);
        String[] size = parts[0].split("x");
        List<String> history = parts.length > 1 && !parts[1].isBlank()
                ? List.of(parts[1].split(","))
                : List.of();
        return new Canvas(Integer.parseInt(size[0]), Integer.parseInt(size[1]), history);
    }

    private List<String> append(String step) {
        List<String> next = new ArrayList<>(history);
        next.add(step);
        return next;
    }
}
