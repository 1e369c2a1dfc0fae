package org.hci.contrast.store;

import java.io.IOException;
import org.hci.contrast.ContrastException;

/**
 * Computes a value which is missing from, or must be replaced in, an
 * {@link ArtifactStore}.
 *
 * @param <T> The type of value
 * @author hci
 */
@FunctionalInterface
public interface ArtifactComputation<T> {

    T compute() throws IOException, ContrastException;
}
