package uk.ac.ntu.gfs.node.store;

import java.util.concurrent.locks.ReentrantReadWriteLock;

// fixed stripes: a handle always maps to the same lock, unknown handles allocate nothing
final class ChunkLocks {
    static final int STRIPES = 64;

    private final ReentrantReadWriteLock[] stripes = new ReentrantReadWriteLock[STRIPES];

    ChunkLocks() {
        for (int i = 0; i < STRIPES; i++) stripes[i] = new ReentrantReadWriteLock();
    }

    ReentrantReadWriteLock lockFor(String handle) {
        return stripes[Math.floorMod(handle.hashCode(), STRIPES)];
    }

    int size() {
        return stripes.length;
    }

    <T, E extends Exception> T withRead(String handle, ThrowingSupplier<T, E> s) throws E {
        var l = lockFor(handle).readLock();
        l.lock();
        try { return s.get(); }
        finally { l.unlock(); }
    }

    <T, E extends Exception> T withWrite(String handle, ThrowingSupplier<T, E> s) throws E {
        var l = lockFor(handle).writeLock();
        l.lock();
        try { return s.get(); }
        finally { l.unlock(); }
    }

    @FunctionalInterface
    interface ThrowingSupplier<T, E extends Exception> { T get() throws E; }
}
