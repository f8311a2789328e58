package hazop.risk.matrix;

import hazop.risk.matrix.MatrixLayout.Box;
import hazop.risk.matrix.MatrixLayout.Label;
import hazop.risk.matrix.MatrixLayout.Swatch;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Paints a {@link MatrixLayout} with Java2D and encodes it as PNG.
 */
public final class PngMatrixRasterizer {
    private static final String FONT_NAME = Font.SANS_SERIF;

    private PngMatrixRasterizer() {
    }

    public static byte[] rasterize(MatrixLayout layout) throws IOException {
        BufferedImage image = new BufferedImage(layout.width(), layout.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            for (Box box : layout.boxes()) {
                paintBox(g, box);
            }
            for (Swatch swatch : layout.swatches()) {
                Rectangle2D square = new Rectangle2D.Double(swatch.x(), swatch.y(), swatch.size(), swatch.size());
                g.setColor(parseColor(swatch.fill()));
                g.fill(square);
                g.setColor(parseColor(swatch.stroke()));
                g.setStroke(new BasicStroke(1));
                g.draw(square);
            }
            for (Label label : layout.labels()) {
                paintLabel(g, label);
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private static void paintBox(Graphics2D g, Box box) {
        RoundRectangle2D shape = new RoundRectangle2D.Double(
                box.x(), box.y(), box.width(), box.height(), box.cornerRadius() * 2, box.cornerRadius() * 2);
        g.setColor(parseColor(box.fill()));
        g.fill(shape);
        if (box.stroke() != null && box.strokeWidth() > 0) {
            g.setColor(parseColor(box.stroke()));
            g.setStroke(new BasicStroke(box.strokeWidth()));
            g.draw(shape);
        }
    }

    private static void paintLabel(Graphics2D g, Label label) {
        Font font = new Font(FONT_NAME, label.fontWeight() >= 600 ? Font.BOLD : Font.PLAIN, label.fontSize());
        g.setFont(font);
        g.setColor(parseColor(label.color()));
        FontMetrics metrics = g.getFontMetrics();
        int textWidth = metrics.stringWidth(label.text());
        double offset = switch (label.anchor()) {
            case START -> 0;
            case MIDDLE -> textWidth / 2.0;
            case END -> textWidth;
        };
        if (label.rotated()) {
            AffineTransform saved = g.getTransform();
            g.rotate(-Math.PI / 2, label.x(), label.y());
            g.drawString(label.text(), (float) (label.x() - offset), (float) label.y());
            g.setTransform(saved);
        } else {
            g.drawString(label.text(), (float) (label.x() - offset), (float) label.y());
        }
    }

    static Color parseColor(String hex) {
        String digits = hex.substring(1);
        if (digits.length() == 3) {
            digits = new String(new char[] {
                    digits.charAt(0), digits.charAt(0),
                    digits.charAt(1), digits.charAt(1),
                    digits.charAt(2), digits.charAt(2)
            });
        }
        return new Color(Integer.parseInt(digits, 16));
    }
}
