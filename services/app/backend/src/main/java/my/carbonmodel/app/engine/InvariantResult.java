package my.carbonmodel.app.engine;

import java.util.List;

/**
 * Outcome of one accounting identity check over a model result.
 *
 * @param details one entry per failing year, empty when the check passes
 */
public record InvariantResult(String name, String description, boolean pass, List<String> details) {
	public InvariantResult {
		details = List.copyOf(details);
	}
}
