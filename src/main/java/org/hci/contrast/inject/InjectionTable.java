package org.hci.contrast.inject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hci.contrast.store.Artifact;
import org.hci.contrast.store.ArtifactCodec;

/**
 * All injection trials of one scenario and KL mode. Row order carries no
 * meaning. A table produced by an interrupted run is marked incomplete and is
 * never reused from storage.
 *
 * @author hci
 */
public class InjectionTable {

    /**
     * Stored as four rows: injected flux, separation, position angle and
     * recovered flux, with COMPLETE and NROWS keywords. An empty table is
     * padded to one NaN column since images cannot be empty.
     */
    public static final ArtifactCodec<InjectionTable> CODEC = new ArtifactCodec<InjectionTable>() {
        @Override
        public Artifact encode(InjectionTable table) {
            int n = table.size();
            double[][] data = new double[4][Math.max(n, 1)];
            if (n == 0) {
                for (double[] row : data) {
                    row[0] = Double.NaN;
                }
            }
            for (int i = 0; i < n; i++) {
                InjectionTrial trial = table.trials.get(i);
                data[0][i] = trial.getInjectedFlux();
                data[1][i] = trial.getSeparation();
                data[2][i] = trial.getPositionAngle();
                data[3][i] = trial.getRecoveredFlux();
            }
            Map<String, Object> keywords = new LinkedHashMap<>();
            keywords.put("COMPLETE", table.complete);
            keywords.put("NROWS", n);
            return new Artifact(data, keywords);
        }

        @Override
        public Optional<InjectionTable> decode(Artifact artifact) {
            if (artifact.getRows() != 4 || !artifact.getBoolean("COMPLETE", false)) {
                return Optional.empty();
            }
            int n = (int) artifact.getDouble("NROWS", artifact.getColumns());
            if (n < 0 || n > artifact.getColumns()) {
                return Optional.empty();
            }
            double[] flux = artifact.getRow(0);
            double[] seps = artifact.getRow(1);
            double[] pas = artifact.getRow(2);
            double[] recovered = artifact.getRow(3);
            List<InjectionTrial> trials = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                trials.add(new InjectionTrial(seps[i], pas[i], flux[i], recovered[i]));
            }
            return Optional.of(new InjectionTable(trials, true));
        }
    };

    private final List<InjectionTrial> trials;
    private final boolean complete;

    public InjectionTable(List<InjectionTrial> trials, boolean complete) {
        this.trials = Collections.unmodifiableList(new ArrayList<>(trials));
        this.complete = complete;
    }

    public List<InjectionTrial> getTrials() {
        return trials;
    }

    public boolean isComplete() {
        return complete;
    }

    public int size() {
        return trials.size();
    }

    @Override
    public String toString() {
        return "InjectionTable{" + "trials=" + trials.size() + ", complete=" + complete + '}';
    }
}
