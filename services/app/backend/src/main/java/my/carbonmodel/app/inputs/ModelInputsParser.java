package my.carbonmodel.app.inputs;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.exc.MismatchedInputException;
import tools.jackson.databind.exc.UnrecognizedPropertyException;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;

public class ModelInputsParser {
	private final ObjectMapper jsonMapper;

	public ModelInputsParser() {
		this.jsonMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
				.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
				.build();
	}

	public ModelInputsDocument parse(String content) {
		if (content == null || content.isBlank()) {
			throw new InputValidationException(List.of("Model inputs are empty"));
		}
		try {
			return jsonMapper.readValue(content, ModelInputsDocument.class);
		} catch (UnrecognizedPropertyException ex) {
			throw new InputValidationException(List.of("unrecognized key: " + ex.getPropertyName()), ex);
		} catch (MismatchedInputException ex) {
			throw new InputValidationException(List.of("invalid value at " + describePath(ex) + ": " + ex.getOriginalMessage()), ex);
		} catch (JacksonException ex) {
			throw new InputValidationException(List.of("Failed to parse model inputs JSON: " + ex.getOriginalMessage()), ex);
		}
	}

	private String describePath(MismatchedInputException ex) {
		String path = ex.getPathReference();
		return path == null || path.isBlank() ? "document" : path;
	}
}
