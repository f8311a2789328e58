package hazop.risk.matrix;

import hazop.risk.error.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

public record MatrixOptions(
        MatrixSize size,
        boolean includeLabels,
        boolean includeLegend,
        boolean showScores,
        String title,
        List<MatrixCell> highlightCells,
        String backgroundColor
) {
    public static final String DEFAULT_BACKGROUND = "#ffffff";
    private static final Pattern HEX_COLOR = Pattern.compile("#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})");

    public MatrixOptions {
        size = size == null ? MatrixSize.MEDIUM : size;
        highlightCells = highlightCells == null ? List.of() : List.copyOf(highlightCells);
        backgroundColor = backgroundColor == null ? DEFAULT_BACKGROUND : backgroundColor;
        if (!HEX_COLOR.matcher(backgroundColor).matches()) {
            throw ValidationException.forField(
                    "backgroundColor",
                    "backgroundColor must be a #rgb or #rrggbb hex color, got " + backgroundColor
            );
        }
    }

    public static MatrixOptions defaults() {
        return new MatrixOptions(MatrixSize.MEDIUM, true, true, true, null, List.of(), DEFAULT_BACKGROUND);
    }

    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    public boolean highlighted(int severity, int likelihood) {
        for (MatrixCell cell : highlightCells) {
            if (cell.severity() == severity && cell.likelihood() == likelihood) {
                return true;
            }
        }
        return false;
    }
}
