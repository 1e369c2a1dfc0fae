package org.hci.contrast.psf;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.hci.contrast.Timed;

/**
 * Memoizes PSFs from a slow provider. Every injection trial asks for the same
 * handful of PSFs, and the cache also takes care of concurrent requests for
 * the same PSF from several workers.
 *
 * @author hci
 */
public class CachingPsfProvider implements PsfProvider {

    private static final Logger LOG = Logger.getLogger(CachingPsfProvider.class.getName());

    private final LoadingCache<PsfKey, double[][]> psfCache;

    public CachingPsfProvider(PsfProvider delegate) {
        this(delegate, Integer.getInteger("org.hci.contrast.psfCacheSize", 1_000));
    }

    public CachingPsfProvider(PsfProvider delegate, long maximumSize) {
        psfCache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build((PsfKey key) -> {
                    return Timed.execute(() -> {
                        return delegate.offsetPsf(key.getFilter(), key.getMask(), key.getPosition());
                    }, "Computing PSF %s took %dms", key);
                });
    }

    @Override
    public double[][] offsetPsf(String filter, String mask, Point2D position) throws IOException {
        try {
            return Psfs.copy(psfCache.get(new PsfKey(filter, mask, position)));
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else {
                throw new IOException("Unexpected exception computing PSF", cause);
            }
        }
    }

    public void report() {
        LOG.log(Level.INFO, "PSF cache size {0} stats {1}", new Object[]{psfCache.estimatedSize(), psfCache.stats()});
    }

    long hitCount() {
        return psfCache.stats().hitCount();
    }
}
