package com.phillippitts.vani.service.resource;

import com.phillippitts.vani.exception.ResourceBusyException;
import com.phillippitts.vani.exception.TurnCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A device that at most one capture may use at a time (microphone, camera).
 *
 * <p>Acquisition is scoped: {@link #acquire()} hands out a {@link Lease} meant for
 * try-with-resources, so the device is released even when the collaborator call fails or the
 * turn is cancelled.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * try (ExclusiveResource.Lease lease = camera.acquire()) {
 *     frame = cameraSource.capture();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe; backed by a single-permit {@link Semaphore}.
 *
 * @since 1.0
 */
public final class ExclusiveResource {

    private static final Logger LOG = LogManager.getLogger(ExclusiveResource.class);

    private final String name;
    private final long timeoutMs;
    private final Semaphore permit = new Semaphore(1);

    /**
     * @param name      device name for logs and errors ("camera", "microphone")
     * @param timeoutMs maximum wait for the device in milliseconds
     */
    public ExclusiveResource(String name, long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0, got: " + timeoutMs);
        }
        this.name = name;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Acquires the device, blocking up to the configured timeout.
     *
     * @return lease that releases the device on {@link Lease#close()}
     * @throws ResourceBusyException   if another capture holds the device past the timeout
     * @throws TurnCancelledException  if the thread is interrupted while waiting
     */
    public Lease acquire() {
        try {
            if (!permit.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new ResourceBusyException(name, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Interrupted while waiting for " + name, e);
        }
        LOG.debug("Acquired {}", name);
        return new Lease();
    }

    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }

    public String name() {
        return name;
    }

    /**
     * Held device. Closing more than once has no further effect.
     */
    public final class Lease implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permit.release();
                LOG.debug("Released {}", name);
            }
        }
    }
}
