package warden.core.model.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A granted admission slot.
 *
 * <p>Must be closed exactly once when the request finishes; further calls to
 * {@link #close()} are ignored.
 */
public final class AdmissionPermit implements AutoCloseable {

    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Runnable onRelease;

    public AdmissionPermit(Runnable onRelease) {
        this.onRelease = onRelease;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}
