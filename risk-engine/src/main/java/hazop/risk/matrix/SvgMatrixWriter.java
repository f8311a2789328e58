package hazop.risk.matrix;

import hazop.risk.matrix.MatrixLayout.Box;
import hazop.risk.matrix.MatrixLayout.Label;
import hazop.risk.matrix.MatrixLayout.Swatch;

import java.math.BigDecimal;

/**
 * Serializes a {@link MatrixLayout} to standalone SVG markup.
 */
public final class SvgMatrixWriter {
    private static final String FONT_FAMILY = "Arial, sans-serif";

    private SvgMatrixWriter() {
    }

    public static String write(MatrixLayout layout) {
        StringBuilder svg = new StringBuilder(8192);
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(layout.width())
                .append("\" height=\"").append(layout.height())
                .append("\" viewBox=\"0 0 ").append(layout.width()).append(' ').append(layout.height())
                .append("\">\n");
        for (Box box : layout.boxes()) {
            appendBox(svg, box);
        }
        for (Swatch swatch : layout.swatches()) {
            appendSwatch(svg, swatch);
        }
        for (Label label : layout.labels()) {
            appendLabel(svg, label);
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    private static void appendBox(StringBuilder svg, Box box) {
        svg.append("  <rect x=\"").append(num(box.x()))
                .append("\" y=\"").append(num(box.y()))
                .append("\" width=\"").append(num(box.width()))
                .append("\" height=\"").append(num(box.height()))
                .append("\" fill=\"").append(escape(box.fill())).append('"');
        if (box.stroke() != null) {
            svg.append(" stroke=\"").append(escape(box.stroke()))
                    .append("\" stroke-width=\"").append(box.strokeWidth()).append('"');
        }
        if (box.cornerRadius() > 0) {
            svg.append(" rx=\"").append(box.cornerRadius()).append('"');
        }
        svg.append("/>\n");
    }

    // Drawn as a path so the rect count stays fixed at background plus cells.
    private static void appendSwatch(StringBuilder svg, Swatch swatch) {
        String x = num(swatch.x());
        String y = num(swatch.y());
        String s = num(swatch.size());
        svg.append("  <path d=\"M").append(x).append(' ').append(y)
                .append(" h").append(s).append(" v").append(s).append(" h-").append(s).append(" Z\"")
                .append(" fill=\"").append(escape(swatch.fill()))
                .append("\" stroke=\"").append(escape(swatch.stroke()))
                .append("\" stroke-width=\"1\"/>\n");
    }

    private static void appendLabel(StringBuilder svg, Label label) {
        String x = num(label.x());
        String y = num(label.y());
        svg.append("  <text x=\"").append(x).append("\" y=\"").append(y)
                .append("\" text-anchor=\"").append(anchor(label.anchor()))
                .append("\" font-family=\"").append(FONT_FAMILY)
                .append("\" font-size=\"").append(label.fontSize()).append('"');
        if (label.fontWeight() != 400) {
            svg.append(" font-weight=\"").append(label.fontWeight()).append('"');
        }
        svg.append(" fill=\"").append(escape(label.color())).append('"');
        if (label.rotated()) {
            svg.append(" transform=\"rotate(-90, ").append(x).append(", ").append(y).append(")\"");
        }
        svg.append('>').append(escape(label.text())).append("</text>\n");
    }

    private static String anchor(MatrixLayout.Anchor anchor) {
        return switch (anchor) {
            case START -> "start";
            case END -> "end";
            case MIDDLE -> "middle";
        };
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String num(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
