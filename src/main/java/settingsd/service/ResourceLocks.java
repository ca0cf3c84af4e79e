package settingsd.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per mutable resource. {@link #acquire} always takes locks in
 * {@link Resource} declaration order, whatever order the caller names them in.
 */
public class ResourceLocks {

    public enum Resource {
        HOSTNAME,
        STATIC_HOSTNAME_FILE,
        MACHINE_INFO_FILE,
        LOCALE_FILE,
        KEYMAP_FILE,
        XORG_KEYBOARD_FILE,
        CLOCK
    }

    private final Map<Resource, ReentrantLock> locks = new EnumMap<>(Resource.class);

    public ResourceLocks() {
        for (Resource resource : Resource.values()) {
            locks.put(resource, new ReentrantLock());
        }
    }

    public Held acquire(Resource first, Resource... rest) {
        EnumSet<Resource> wanted = EnumSet.of(first, rest);
        List<ReentrantLock> taken = new ArrayList<>(wanted.size());
        try {
            for (Resource resource : wanted) {
                ReentrantLock lock = locks.get(resource);
                lock.lock();
                taken.add(lock);
            }
        } catch (RuntimeException | Error ex) {
            new Held(taken).close();
            throw ex;
        }
        return new Held(taken);
    }

    public boolean isHeldByCurrentThread(Resource resource) {
        return locks.get(resource).isHeldByCurrentThread();
    }

    public static final class Held implements AutoCloseable {
        private final List<ReentrantLock> taken;
        private boolean released;

        private Held(List<ReentrantLock> taken) {
            this.taken = taken;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            List<ReentrantLock> reversed = new ArrayList<>(taken);
            Collections.reverse(reversed);
            for (ReentrantLock lock : reversed) {
                lock.unlock();
            }
        }
    }
}
