package treeqa.model;

/**
 * Axis-aligned rectangle in root coordinates.
 */
public record Bounds(double x, double y, double width, double height) {

    public boolean contains(double px, double py) {
        return width > 0 && height > 0
                && px >= x && px < x + width
                && py >= y && py < y + height;
    }
}
