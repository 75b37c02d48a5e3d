package my.carbonmodel.app;

import my.carbonmodel.app.engine.EngineSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(properties = "app.model.irr.max-iterations=50")
class AppApplicationTests {
	@Autowired
	private EngineSettings engineSettings;

	@Test
	void contextLoads() {
		assertThat(engineSettings.schemaVersion()).isEqualTo("1.0");
		assertThat(engineSettings.irrMaxIterations()).isEqualTo(50);
		assertThat(engineSettings.balanceTolerance()).isEqualByComparingTo("0.01");
	}
}
