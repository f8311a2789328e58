package hazop.risk.matrix;

public record SvgRendering(String markup, int width, int height) {}
