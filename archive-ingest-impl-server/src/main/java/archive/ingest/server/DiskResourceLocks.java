package archive.ingest.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-slot mutual exclusion for the physical write phase of archive requests.
 * <p>
 * Concurrent writers targeting the same slot are serialized to avoid disk thrashing; writers on different
 * slots never block each other. The lock is not needed for the correctness of the data itself, and
 * {@link #none()} provides a registry that never blocks, without any other change in behavior.
 * <p>
 * Usage:
 * <pre>{@code
 * try (DiskResourceLocks.DiskResourceLock lock = locks.acquire(volume.getSlotId())) {
 *     // write bytes
 * }
 * }</pre>
 */
public class DiskResourceLocks {
    private static final Logger logger = LoggerFactory.getLogger(DiskResourceLocks.class);

    private static final DiskResourceLocks NONE = new DiskResourceLocks(false);

    private final boolean enabled;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public DiskResourceLocks() {
        this(true);
    }

    private DiskResourceLocks(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return a registry whose locks never block
     */
    public static DiskResourceLocks none() {
        return NONE;
    }

    /**
     * @param mutexDiskAccess whether mutual exclusion is requested
     * @return a new registry if requested, otherwise {@link #none()}
     */
    public static DiskResourceLocks forConfiguration(boolean mutexDiskAccess) {
        return mutexDiskAccess ? new DiskResourceLocks() : none();
    }

    /**
     * Blocks until the lock for the given slot is available.
     *
     * @param slotId slot of the target volume
     * @return the held lock, to be released by {@link DiskResourceLock#close()}
     * @throws InterruptedException if interrupted while waiting; the lock is not held in that case
     */
    public DiskResourceLock acquire(String slotId) throws InterruptedException {
        Objects.requireNonNull(slotId, "Slot ID must not be null");
        if (!enabled) {
            return new DiskResourceLock(slotId, null);
        }
        ReentrantLock lock = locks.computeIfAbsent(slotId, k -> new ReentrantLock(true));
        if (lock.isLocked() && logger.isDebugEnabled()) {
            logger.debug("Waiting for disk resource of slot {}", slotId);
        }
        lock.lockInterruptibly();
        logger.debug("Acquired disk resource of slot {}", slotId);
        return new DiskResourceLock(slotId, lock);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * A held disk resource lock. Closing it more than once has no further effect.
     */
    public static final class DiskResourceLock implements AutoCloseable {
        private final String slotId;
        private ReentrantLock lock;

        private DiskResourceLock(String slotId, ReentrantLock lock) {
            this.slotId = slotId;
            this.lock = lock;
        }

        public String getSlotId() {
            return slotId;
        }

        @Override
        public void close() {
            if (lock != null) {
                lock.unlock();
                lock = null;
                logger.debug("Released disk resource of slot {}", slotId);
            }
        }
    }
}
