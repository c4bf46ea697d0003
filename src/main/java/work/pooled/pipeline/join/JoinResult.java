package work.pooled.pipeline.join;

import java.util.List;
import work.pooled.pipeline.error.JoinException;

public record JoinResult(List<JoinedGroup> joined, List<JoinException> failures) {
    public JoinResult {
        joined = List.copyOf(joined);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
