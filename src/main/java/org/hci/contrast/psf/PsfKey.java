package org.hci.contrast.psf;

import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * Cache key for a computed PSF.
 *
 * @author hci
 */
class PsfKey {

    private final String filter;
    private final String mask;
    private final Point2D position;

    PsfKey(String filter, String mask, Point2D position) {
        this.filter = filter;
        this.mask = mask;
        this.position = position == null ? null : new Point2D.Double(position.getX(), position.getY());
    }

    String getFilter() {
        return filter;
    }

    String getMask() {
        return mask;
    }

    Point2D getPosition() {
        return position;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.filter);
        hash = 19 * hash + Objects.hashCode(this.mask);
        hash = 19 * hash + Objects.hashCode(this.position);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final PsfKey other = (PsfKey) obj;
        return Objects.equals(this.filter, other.filter)
                && Objects.equals(this.mask, other.mask)
                && Objects.equals(this.position, other.position);
    }

    @Override
    public String toString() {
        return "PsfKey{" + "filter=" + filter + ", mask=" + mask + ", position=" + position + '}';
    }
}
