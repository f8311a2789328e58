package hazop.risk.lopa;

public record IplCredit(String name, IplType type, double pfd, double rrf, boolean credited) {}
