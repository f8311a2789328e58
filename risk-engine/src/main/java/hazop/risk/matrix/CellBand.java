package hazop.risk.matrix;

public enum CellBand {
    LOW("#dcfce7", "#166534", "#86efac", "Low Risk"),
    MEDIUM("#fef3c7", "#92400e", "#fcd34d", "Medium Risk"),
    HIGH("#fee2e2", "#991b1b", "#fca5a5", "High Risk");

    private final String fill;
    private final String textColor;
    private final String border;
    private final String legendLabel;

    CellBand(String fill, String textColor, String border, String legendLabel) {
        this.fill = fill;
        this.textColor = textColor;
        this.border = border;
        this.legendLabel = legendLabel;
    }

    public static CellBand of(int baseScore) {
        if (baseScore <= 4) {
            return LOW;
        }
        if (baseScore <= 14) {
            return MEDIUM;
        }
        return HIGH;
    }

    public String fill() {
        return fill;
    }

    public String textColor() {
        return textColor;
    }

    public String border() {
        return border;
    }

    public String legendLabel() {
        return legendLabel;
    }
}
