package hazop.risk.matrix;

import java.util.List;

/**
 * Geometry of a rendered matrix, shared by the SVG writer and the rasterizer.
 * The first rect is the background, the remaining 25 are the cells.
 */
public record MatrixLayout(
        int width,
        int height,
        List<Box> boxes,
        List<Label> labels,
        List<Swatch> swatches
) {
    public enum Anchor { START, MIDDLE, END }

    public record Box(double x, double y, double width, double height,
                      String fill, String stroke, int strokeWidth, int cornerRadius) {}

    /**
     * Text placed at its baseline. {@code rotated} turns it -90 degrees around (x, y).
     */
    public record Label(double x, double y, String text, int fontSize, int fontWeight,
                        String color, Anchor anchor, boolean rotated) {}

    public record Swatch(double x, double y, double size, String fill, String stroke) {}
}
