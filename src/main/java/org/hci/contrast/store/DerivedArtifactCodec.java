package org.hci.contrast.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Wraps a codec for a product computed from other artifacts. The
 * fingerprints of the inputs are stored with the product, and a stored
 * product whose inputs have changed since is not reused.
 *
 * @param <T> The type of value
 * @author hci
 */
public class DerivedArtifactCodec<T> implements ArtifactCodec<T> {

    static final String INPUTS = "INPUTS";

    private final ArtifactCodec<T> codec;
    private final String inputs;

    /**
     * @param codec The codec of the product
     * @param inputs The artifacts the product is computed from, at most
     * four so the fingerprints fit on one header card
     */
    public DerivedArtifactCodec(ArtifactCodec<T> codec, Artifact... inputs) {
        if (inputs.length == 0 || inputs.length > 4) {
            throw new IllegalArgumentException("Between 1 and 4 inputs required, got " + inputs.length);
        }
        this.codec = codec;
        StringBuilder builder = new StringBuilder();
        for (Artifact input : inputs) {
            builder.append(input.fingerprint());
        }
        this.inputs = builder.toString();
    }

    @Override
    public Artifact encode(T value) {
        Artifact artifact = codec.encode(value);
        Map<String, Object> keywords = new LinkedHashMap<>(artifact.getKeywords());
        keywords.put(INPUTS, inputs);
        return new Artifact(artifact.getData(), keywords);
    }

    @Override
    public Optional<T> decode(Artifact artifact) {
        if (!inputs.equals(artifact.getString(INPUTS))) {
            return Optional.empty();
        }
        return codec.decode(artifact);
    }
}
