package org.hci.contrast.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps artifacts in memory, for single runs where nothing needs to survive
 * the process.
 *
 * @author hci
 */
public class MemoryArtifactStore extends ArtifactStore {

    private final Map<ArtifactKey, Artifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public Optional<Artifact> load(ArtifactKey key) {
        return Optional.ofNullable(artifacts.get(key));
    }

    @Override
    public void save(ArtifactKey key, Artifact artifact) {
        artifacts.put(key, artifact);
    }

    public int size() {
        return artifacts.size();
    }
}
