package hazop.risk.matrix;

public record ImageRendering(byte[] bytes, String mimeType, String filename, int width, int height) {}
