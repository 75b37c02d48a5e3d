package my.carbonmodel.app.dto;

import java.util.List;

public record ModelValidationResponse(boolean valid, List<String> errors, List<String> warnings) {
}
