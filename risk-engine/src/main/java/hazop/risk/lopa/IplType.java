package hazop.risk.lopa;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IplType {
    SAFETY_INSTRUMENTED_FUNCTION(0.01, 0.00001),
    BASIC_PROCESS_CONTROL(0.1, 0.01),
    RELIEF_DEVICE(0.01, 0.001),
    ALARM(0.1, 0.01),
    INTERLOCK(0.01, 0.001),
    PHYSICAL_CONTAINMENT(0.01, 0.001),
    PROCEDURAL(0.1, 0.01),
    EMERGENCY_RESPONSE(0.1, 0.01),
    OTHER(0.1, 0.01);

    private static final double MAX_CREDITABLE_PFD = 0.1;

    private final double typicalPfd;
    private final double minCreditablePfd;

    IplType(double typicalPfd, double minCreditablePfd) {
        this.typicalPfd = typicalPfd;
        this.minCreditablePfd = minCreditablePfd;
    }

    public double typicalPfd() {
        return typicalPfd;
    }

    public double minCreditablePfd() {
        return minCreditablePfd;
    }

    public double maxCreditablePfd() {
        return MAX_CREDITABLE_PFD;
    }

    /**
     * A SIF with a declared SIL gets the upper bound of that SIL's band; every
     * other layer gets its typical PFD.
     */
    public double suggestedPfd(Integer sil) {
        if (this == SAFETY_INSTRUMENTED_FUNCTION && sil != null) {
            Double bound = SilBand.maxPfd(sil);
            if (bound != null) {
                return bound;
            }
        }
        return typicalPfd;
    }

    boolean humanResponse() {
        return this == ALARM || this == PROCEDURAL || this == EMERGENCY_RESPONSE;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IplType fromWire(String value) {
        for (IplType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown IPL type: " + value);
    }
}
