package org.hci.contrast.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.hci.contrast.ContrastCurve;
import org.hci.contrast.store.Artifact;
import org.hci.contrast.store.ArtifactCodec;

/**
 * Stores contrast curves sharing one separation axis as a table whose first
 * row holds the separations (pixels) and each further row the contrasts of
 * one KL mode. The pixel scale is kept in the PIXSCALE keyword.
 *
 * @author hci
 */
class ContrastCurveCodec implements ArtifactCodec<List<ContrastCurve>> {

    static final ContrastCurveCodec CURVES = new ContrastCurveCodec();

    static final ArtifactCodec<ContrastCurve> SINGLE = new ArtifactCodec<ContrastCurve>() {
        @Override
        public Artifact encode(ContrastCurve curve) {
            return CURVES.encode(Collections.singletonList(curve));
        }

        @Override
        public Optional<ContrastCurve> decode(Artifact artifact) {
            Optional<List<ContrastCurve>> curves = CURVES.decode(artifact);
            if (curves.isPresent() && curves.get().size() == 1) {
                return Optional.of(curves.get().get(0));
            }
            return Optional.empty();
        }
    };

    @Override
    public Artifact encode(List<ContrastCurve> curves) {
        if (curves.isEmpty()) {
            throw new IllegalArgumentException("No curves to store");
        }
        double[][] data = new double[curves.size() + 1][];
        data[0] = curves.get(0).getSeparations();
        for (int i = 0; i < curves.size(); i++) {
            data[i + 1] = curves.get(i).getContrasts();
        }
        return new Artifact(data, Collections.singletonMap("PIXSCALE", curves.get(0).getPixelScale()));
    }

    @Override
    public Optional<List<ContrastCurve>> decode(Artifact artifact) {
        double pixelScale = artifact.getDouble("PIXSCALE", Double.NaN);
        if (artifact.getRows() < 2 || !(pixelScale > 0)) {
            return Optional.empty();
        }
        double[] separations = artifact.getRow(0);
        List<ContrastCurve> result = new ArrayList<>(artifact.getRows() - 1);
        for (int i = 1; i < artifact.getRows(); i++) {
            result.add(new ContrastCurve(separations, artifact.getRow(i), pixelScale));
        }
        return Optional.of(result);
    }
}
