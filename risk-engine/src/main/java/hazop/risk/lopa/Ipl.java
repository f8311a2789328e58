package hazop.risk.lopa;

public record Ipl(
        String name,
        IplType type,
        double pfd,
        boolean independentOfInitiator,
        boolean independentOfOtherIpls,
        Integer sil
) {
    public double rrf() {
        return 1.0 / pfd;
    }

    public boolean creditable() {
        return independentOfInitiator && independentOfOtherIpls;
    }
}
