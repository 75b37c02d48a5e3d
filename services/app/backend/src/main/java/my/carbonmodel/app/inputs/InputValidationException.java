package my.carbonmodel.app.inputs;

import java.util.List;

public class InputValidationException extends RuntimeException {
	private final List<String> errors;

	public InputValidationException(List<String> errors) {
		this(errors, null);
	}

	public InputValidationException(List<String> errors, Throwable cause) {
		super("Model inputs invalid: " + String.join("; ", errors), cause);
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
