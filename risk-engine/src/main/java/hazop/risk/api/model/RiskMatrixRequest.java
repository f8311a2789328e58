package hazop.risk.api.model;

import hazop.risk.error.ValidationException;
import hazop.risk.matrix.MatrixCell;
import hazop.risk.matrix.MatrixOptions;
import hazop.risk.matrix.MatrixSize;

import java.util.ArrayList;
import java.util.List;

/**
 * Matrix rendering request. Omitted fields take the renderer defaults;
 * {@code highlightCells} is a list of [severity, likelihood] pairs.
 */
public record RiskMatrixRequest(
        String size,
        Boolean includeLabels,
        Boolean includeLegend,
        Boolean showScores,
        String title,
        List<List<Integer>> highlightCells,
        String backgroundColor
) {
    public MatrixOptions toOptions() {
        List<MatrixCell> cells = new ArrayList<>();
        if (highlightCells != null) {
            for (int i = 0; i < highlightCells.size(); i++) {
                List<Integer> pair = highlightCells.get(i);
                if (pair == null || pair.size() != 2) {
                    throw ValidationException.forField("highlightCells[" + i + "]",
                            "highlightCells[" + i + "] must be a [severity, likelihood] pair");
                }
                cells.add(new MatrixCell(
                        requirePresent(pair.get(0), i, "severity"),
                        requirePresent(pair.get(1), i, "likelihood")));
            }
        }
        return new MatrixOptions(
                MatrixSize.fromWire(size),
                includeLabels == null || includeLabels,
                includeLegend == null || includeLegend,
                showScores == null || showScores,
                title,
                cells,
                backgroundColor
        );
    }

    private static int requirePresent(Integer value, int index, String part) {
        if (value == null) {
            throw ValidationException.forField("highlightCells[" + index + "]",
                    "highlightCells[" + index + "] " + part + " is required");
        }
        return value;
    }
}
