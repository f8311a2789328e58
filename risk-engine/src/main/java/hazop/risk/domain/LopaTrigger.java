package hazop.risk.domain;

public record LopaTrigger(boolean required, boolean recommended, String reason) {}
