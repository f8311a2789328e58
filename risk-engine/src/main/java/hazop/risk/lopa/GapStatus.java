package hazop.risk.lopa;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GapStatus {
    ADEQUATE,
    MARGINAL,
    INADEQUATE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
