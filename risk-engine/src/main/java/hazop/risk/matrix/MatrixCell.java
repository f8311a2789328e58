package hazop.risk.matrix;

import hazop.risk.domain.RiskScale;

public record MatrixCell(int severity, int likelihood) {
    public MatrixCell {
        RiskScale.require("highlightCells.severity", severity);
        RiskScale.require("highlightCells.likelihood", likelihood);
    }
}
