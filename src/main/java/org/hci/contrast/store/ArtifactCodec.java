package org.hci.contrast.store;

import java.util.Optional;

/**
 * Converts a value to and from its stored form.
 *
 * @param <T> The type of value
 * @author hci
 */
public interface ArtifactCodec<T> {

    Artifact encode(T value);

    /**
     * @param artifact The stored artifact
     * @return The value, or empty if the stored artifact must not be reused
     * (for example because it was only partially computed)
     */
    Optional<T> decode(Artifact artifact);
}
