package hazop.risk.api;

import hazop.risk.error.ValidationException;

import java.util.UUID;

final class RequestIds {
    private RequestIds() {
    }

    static String next() {
        return "hz_" + UUID.randomUUID().toString().replace("-", "");
    }

    static UUID parseUuid(String raw, String message) {
        UUID parsed;
        try {
            parsed = UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw ValidationException.forField("id", message);
        }
        // fromString also accepts short groups such as "1-2-3-4-5"
        if (!parsed.toString().equalsIgnoreCase(raw)) {
            throw ValidationException.forField("id", message);
        }
        return parsed;
    }
}
