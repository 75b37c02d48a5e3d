package my.carbonmodel.app.api;

import my.carbonmodel.app.support.ModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.carbonmodel.app.AppApplication.class)
class FinancialModelApiIntegrationTest {
	private final ObjectMapper objectMapper = JsonMapper.builder().build();

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void computeReturnsLinkedStatements() throws Exception {
		String payload = mockMvc.perform(post("/api/models/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO)))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.schema_version").value("1.0"))
				.andExpect(jsonPath("$.incomeStatements", hasSize(3)))
				.andExpect(jsonPath("$.metrics.equity_irr").value(nullValue()))
				.andReturn()
				.getResponse()
				.getContentAsString();

		JsonNode root = objectMapper.readTree(payload);
		assertThat(root.path("incomeStatements").get(1).path("total_revenue").asDouble()).isCloseTo(10000.0, within(0.001));
		assertThat(root.path("incomeStatements").get(1).path("ebitda").asDouble()).isCloseTo(-2000.0, within(0.001));
		assertThat(root.path("carbonStream").get(1).path("purchased_credits").asDouble()).isCloseTo(200.0, within(0.001));
		assertThat(root.path("debtSchedule").get(0).path("principal_payment").asDouble()).isCloseTo(-4761.90, within(0.01));
		assertThat(root.path("inputs").path("staff_costs").get(0).asDouble()).isEqualTo(-10000.0);
		JsonNode balanceSheets = root.path("balanceSheets");
		for (int i = 0; i < balanceSheets.size(); i++) {
			assertThat(Math.abs(balanceSheets.get(i).path("balance_check").asDouble())).isLessThan(0.01);
		}
	}

	@Test
	void computeRejectsUnknownKey() throws Exception {
		mockMvc.perform(post("/api/models/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("tax_holiday", true))))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"))
				.andExpect(jsonPath("$.errors", hasItem("unrecognized key: tax_holiday")));
	}

	@Test
	void computeRejectsInvalidInputs() throws Exception {
		mockMvc.perform(post("/api/models/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("debt_duration_years", 0))))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errors", hasItem("debt_duration_years must be a positive integer")));
	}

	@Test
	void validateNeverFailsOnBadInputs() throws Exception {
		mockMvc.perform(post("/api/models/validate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("ap_rate", 3))))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.valid").value(false))
				.andExpect(jsonPath("$.errors", hasItem("ap_rate must be between 0 and 1")));
	}

	@Test
	void validateReturnsWarnings() throws Exception {
		mockMvc.perform(post("/api/models/validate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("initial_ppe", 1000))))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.valid").value(true))
				.andExpect(jsonPath("$.warnings", hasSize(1)));
	}

	@Test
	void exportReturnsCsv() throws Exception {
		mockMvc.perform(post("/api/models/export/balance-sheet")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO)))
				.andExpect(status().isOk())
				.andExpect(header().string("Content-Disposition", "attachment; filename=balance-sheet.csv"))
				.andExpect(content().contentTypeCompatibleWith("text/csv"))
				.andExpect(content().string(startsWith("year,cash,accounts_receivable")));
	}

	@Test
	void exportRejectsUnknownStatement() throws Exception {
		mockMvc.perform(post("/api/models/export/ratios")
						.contentType(MediaType.APPLICATION_JSON)
						.content(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO)))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Unknown statement: ratios"));
	}
}
