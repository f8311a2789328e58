package hazop.risk.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import hazop.risk.error.FieldViolation;

import java.util.List;

public record ErrorResponse(boolean success, ErrorBody error) {
    public static ErrorResponse of(String code, String message, List<FieldViolation> errors) {
        return new ErrorResponse(false, new ErrorBody(code, message, errors == null || errors.isEmpty() ? null : errors));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String code, String message, List<FieldViolation> errors) {}
}
