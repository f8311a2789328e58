package hazop.risk.matrix;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import hazop.risk.error.ValidationException;

import java.util.Locale;

public enum MatrixSize {
    SMALL(40, 80, 30, 10, 12, 14, 30, 10),
    MEDIUM(60, 100, 40, 12, 16, 18, 40, 15),
    LARGE(80, 120, 50, 14, 20, 22, 50, 20);

    private final int cellSize;
    private final int labelWidth;
    private final int labelHeight;
    private final int fontSize;
    private final int scoreFontSize;
    private final int titleFontSize;
    private final int legendHeight;
    private final int padding;

    MatrixSize(
            int cellSize,
            int labelWidth,
            int labelHeight,
            int fontSize,
            int scoreFontSize,
            int titleFontSize,
            int legendHeight,
            int padding
    ) {
        this.cellSize = cellSize;
        this.labelWidth = labelWidth;
        this.labelHeight = labelHeight;
        this.fontSize = fontSize;
        this.scoreFontSize = scoreFontSize;
        this.titleFontSize = titleFontSize;
        this.legendHeight = legendHeight;
        this.padding = padding;
    }

    public int cellSize() {
        return cellSize;
    }

    public int labelWidth() {
        return labelWidth;
    }

    public int labelHeight() {
        return labelHeight;
    }

    public int fontSize() {
        return fontSize;
    }

    public int scoreFontSize() {
        return scoreFontSize;
    }

    public int titleFontSize() {
        return titleFontSize;
    }

    public int legendHeight() {
        return legendHeight;
    }

    public int padding() {
        return padding;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MatrixSize fromWire(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (MatrixSize size : values()) {
            if (size.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return size;
            }
        }
        throw ValidationException.forField("size", "size must be one of small, medium, large, got " + value);
    }
}
