package hazop.risk.api.model;

public record ScoreRequest(Integer severity, Integer likelihood, Integer detectability) {}
