package my.carbonmodel.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.carbonmodel.app.dto.ModelValidationResponse;
import my.carbonmodel.app.engine.ModelResult;
import my.carbonmodel.app.service.FinancialModelService;
import my.carbonmodel.app.service.StatementType;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/models")
@Tag(name = "Financial Models")
public class FinancialModelController {
	private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

	private final FinancialModelService modelService;

	public FinancialModelController(FinancialModelService modelService) {
		this.modelService = modelService;
	}

	@PostMapping(path = "/compute", consumes = MediaType.APPLICATION_JSON_VALUE)
	@Operation(summary = "Compute the financial statements and return metrics")
	public ModelResult compute(@RequestBody String inputsJson) {
		return modelService.compute(inputsJson);
	}

	@PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
	@Operation(summary = "Validate model inputs without computing")
	public ModelValidationResponse validate(@RequestBody String inputsJson) {
		return modelService.validate(inputsJson);
	}

	@PostMapping(path = "/export/{statement}", consumes = MediaType.APPLICATION_JSON_VALUE)
	@Operation(summary = "Export one statement as CSV")
	public ResponseEntity<String> export(@PathVariable String statement, @RequestBody String inputsJson) {
		StatementType type = StatementType.fromSlug(statement);
		String csv = modelService.export(inputsJson, type);
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + type.getSlug() + ".csv")
				.contentType(TEXT_CSV)
				.body(csv);
	}
}
