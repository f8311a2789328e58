package hazop.risk.matrix;

import hazop.risk.domain.RiskScale;
import hazop.risk.matrix.MatrixLayout.Anchor;
import hazop.risk.matrix.MatrixLayout.Box;
import hazop.risk.matrix.MatrixLayout.Label;
import hazop.risk.matrix.MatrixLayout.Swatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes matrix geometry. Severity runs along the columns (1 to 5, left to
 * right) and likelihood along the rows (5 to 1, top to bottom).
 */
public final class MatrixLayoutEngine {
    static final String TEXT_COLOR = "#374151";
    static final String HIGHLIGHT_COLOR = "#3b82f6";
    private static final int GRID_CELLS = RiskScale.MAX;
    private static final double CHAR_WIDTH_EM = 0.6;
    private static final int LEGEND_TEXT_OFFSET = 8;
    private static final int LEGEND_GAP = 12;

    private MatrixLayoutEngine() {
    }

    public static MatrixLayout layout(MatrixOptions options) {
        MatrixSize size = options.size();
        int cell = size.cellSize();
        int grid = GRID_CELLS * cell;
        int labelWidth = options.includeLabels() ? size.labelWidth() : 0;
        int labelHeight = options.includeLabels() ? size.labelHeight() : 0;
        int axisTitleSpace = options.includeLabels() ? size.fontSize() * 2 : 0;
        int titleHeight = options.hasTitle() ? size.titleFontSize() * 2 : 0;
        int legendHeight = options.includeLegend() ? size.legendHeight() : 0;

        int gridX = size.padding() + axisTitleSpace + labelWidth;
        double box = size.legendHeight() * 0.5;
        double legendItem = box + LEGEND_TEXT_OFFSET + widestLegendLabel(size.fontSize());
        double legendSpacing = legendItem + LEGEND_GAP;

        int width = size.padding() * 2 + axisTitleSpace + labelWidth + grid;
        if (options.includeLegend()) {
            double legendWidth = legendSpacing * (CellBand.values().length - 1) + legendItem;
            width = Math.max(width, (int) Math.ceil(gridX + legendWidth) + size.padding());
        }
        int height = size.padding() * 2 + titleHeight + labelHeight + grid + labelHeight + legendHeight;

        List<Box> boxes = new ArrayList<>();
        List<Label> labels = new ArrayList<>();
        List<Swatch> swatches = new ArrayList<>();

        boxes.add(new Box(0, 0, width, height, options.backgroundColor(), null, 0, 0));

        int top = size.padding();
        if (options.hasTitle()) {
            labels.add(new Label(width / 2.0, top + size.titleFontSize(), options.title(),
                    size.titleFontSize(), 700, TEXT_COLOR, Anchor.MIDDLE, false));
            top += titleHeight;
        }

        int gridY = top + labelHeight;

        for (int row = 0; row < GRID_CELLS; row++) {
            int likelihood = GRID_CELLS - row;
            for (int col = 0; col < GRID_CELLS; col++) {
                int severity = col + 1;
                CellBand band = CellBand.of(severity * likelihood);
                boolean highlighted = options.highlighted(severity, likelihood);
                double x = gridX + col * cell;
                double y = gridY + row * cell;
                boxes.add(new Box(x, y, cell, cell, band.fill(),
                        highlighted ? HIGHLIGHT_COLOR : band.border(), highlighted ? 3 : 1, 2));
                if (options.showScores()) {
                    labels.add(new Label(x + cell / 2.0, y + cell / 2.0 + size.scoreFontSize() / 3.0,
                            String.valueOf(severity * likelihood), size.scoreFontSize(), 600,
                            band.textColor(), Anchor.MIDDLE, false));
                }
            }
        }

        if (options.includeLabels()) {
            addAxisLabels(labels, size, gridX, gridY, top, labelWidth, labelHeight, grid);
        }

        if (options.includeLegend()) {
            double legendY = gridY + grid + labelHeight + 5;
            double x = gridX;
            for (CellBand band : CellBand.values()) {
                swatches.add(new Swatch(x, legendY + (size.legendHeight() - box) / 2, box,
                        band.fill(), band.border()));
                labels.add(new Label(x + box + LEGEND_TEXT_OFFSET, legendY + size.legendHeight() / 2.0 + size.fontSize() / 3.0,
                        band.legendLabel(), size.fontSize(), 400, TEXT_COLOR, Anchor.START, false));
                x += legendSpacing;
            }
        }

        return new MatrixLayout(width, height, List.copyOf(boxes), List.copyOf(labels), List.copyOf(swatches));
    }

    /**
     * Width estimate for text in the sans-serif face, used to keep legend entries
     * apart without font metrics.
     */
    static double estimatedTextWidth(String text, int fontSize) {
        return text.length() * fontSize * CHAR_WIDTH_EM;
    }

    private static double widestLegendLabel(int fontSize) {
        double widest = 0;
        for (CellBand band : CellBand.values()) {
            widest = Math.max(widest, estimatedTextWidth(band.legendLabel(), fontSize));
        }
        return widest;
    }

    private static void addAxisLabels(
            List<Label> labels,
            MatrixSize size,
            int gridX,
            int gridY,
            int top,
            int labelWidth,
            int labelHeight,
            int grid
    ) {
        int cell = size.cellSize();
        int font = size.fontSize();
        double rowLabelX = size.padding() + font * 2 + labelWidth - 8;
        for (int row = 0; row < GRID_CELLS; row++) {
            int likelihood = GRID_CELLS - row;
            labels.add(new Label(rowLabelX, gridY + row * cell + cell / 2.0 + font / 3.0,
                    likelihood + " - " + RiskScale.likelihoodLabel(likelihood), font, 400,
                    TEXT_COLOR, Anchor.END, false));
        }
        for (int col = 0; col < GRID_CELLS; col++) {
            int severity = col + 1;
            labels.add(new Label(gridX + col * cell + cell / 2.0, top + labelHeight - 8,
                    severity + " - " + RiskScale.severityLabel(severity), font, 400,
                    TEXT_COLOR, Anchor.MIDDLE, false));
        }
        labels.add(new Label(size.padding() + font / 2.0, gridY + grid / 2.0, "Likelihood",
                font, 600, TEXT_COLOR, Anchor.MIDDLE, true));
        labels.add(new Label(gridX + grid / 2.0, gridY + grid + labelHeight - 5, "Severity",
                font, 600, TEXT_COLOR, Anchor.MIDDLE, false));
    }
}
