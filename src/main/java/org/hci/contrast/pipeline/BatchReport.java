package org.hci.contrast.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.ScenarioConfig;

/**
 * Outcome of a batch run: the calibrated curve of each scenario which
 * succeeded and the failure of each one which did not.
 *
 * @author hci
 */
public class BatchReport {

    private final Map<ScenarioConfig, ContrastCurve> successes = new LinkedHashMap<>();
    private final Map<ScenarioConfig, Throwable> failures = new LinkedHashMap<>();

    void addSuccess(ScenarioConfig scenario, ContrastCurve curve) {
        successes.put(scenario, curve);
    }

    void addFailure(ScenarioConfig scenario, Throwable failure) {
        failures.put(scenario, failure);
    }

    public Map<ScenarioConfig, ContrastCurve> getSuccesses() {
        return Collections.unmodifiableMap(successes);
    }

    public Map<ScenarioConfig, Throwable> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(successes.size()).append(" scenarios succeeded, ").append(failures.size()).append(" failed");
        for (Map.Entry<ScenarioConfig, Throwable> entry : failures.entrySet()) {
            builder.append("\n  ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return builder.toString();
    }
}
