package org.hci.contrast.store;

import java.io.IOException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.ContrastException;

/**
 * Persistent storage of pipeline products, which also acts as the
 * memoization layer between runs. Stored artifacts are never modified, a
 * recomputed artifact replaces the old one as a whole.
 *
 * @author hci
 */
public abstract class ArtifactStore {

    private static final Logger LOG = Logger.getLogger(ArtifactStore.class.getName());

    /**
     * @param key The artifact to load
     * @return The artifact, or empty if it does not exist
     * @throws IOException If the artifact exists but cannot be read
     */
    public abstract Optional<Artifact> load(ArtifactKey key) throws IOException;

    /**
     * Store an artifact, replacing any previous version atomically.
     */
    public abstract void save(ArtifactKey key, Artifact artifact) throws IOException;

    /**
     * Return the stored value if there is a usable one and overwrite is not
     * requested, otherwise compute, store and return it. A missing or
     * unreadable artifact simply triggers the computation. When the stored
     * value is reused nothing is written.
     *
     * @param <T> The type of the value
     * @param key The artifact key
     * @param overwrite If <code>true</code> always recompute
     * @param codec Converts values to and from artifacts
     * @param computation Computes the value when needed
     * @return The value
     * @throws IOException If the value cannot be stored
     * @throws ContrastException If the computation fails
     */
    public <T> T getOrCompute(ArtifactKey key, boolean overwrite, ArtifactCodec<T> codec, ArtifactComputation<T> computation) throws IOException, ContrastException {
        if (!overwrite) {
            Optional<Artifact> stored;
            try {
                stored = load(key);
            } catch (IOException x) {
                LOG.log(Level.WARNING, "Unreadable artifact " + key + ", recomputing", x);
                stored = Optional.empty();
            }
            if (stored.isPresent()) {
                Optional<T> value = codec.decode(stored.get());
                if (value.isPresent()) {
                    LOG.log(Level.FINE, "Reusing {0}", key);
                    return value.get();
                }
                LOG.log(Level.INFO, "Stored {0} is not reusable, recomputing", key);
            }
        }
        T value = computation.compute();
        save(key, codec.encode(value));
        return value;
    }
}
