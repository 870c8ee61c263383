package imstream.core.cache;

import org.apache.log4j.Logger;

import java.io.IOException;

/**
 * Fixed-size cache for slow-to-load objects keyed by an integer, with
 * least-recently-used eviction.
 *
 * Every slot carries a use rank taken from a counter that grows on each
 * successful {@link #get}. A miss evicts the slot with the smallest rank;
 * among equal ranks (only possible before every slot has been used) the
 * lowest slot wins.
 *
 * A capacity of 1 keeps only the most recent object: it reloads unless the
 * same key is asked for twice in a row.
 *
 * @param <V> type of the cached objects
 */
public class LruCache<V> {

    private static final Logger LOGGER = Logger.getLogger(LruCache.class);

    /**
     * Produces the object for a key on a cache miss.
     */
    @FunctionalInterface
    public interface Loader<V> {
        V load(int key) throws IOException;
    }

    private final Loader<V> loader;
    private final int[] keys;
    private final boolean[] occupied;
    private final Object[] values;
    private final long[] ranks;
    private long counter;
    private long hitCount;
    private long loadCount;

    public LruCache(Loader<V> loader) {
        this(loader, 1);
    }

    /**
     * @param loader called with the key on each miss
     * @param capacity number of objects kept; values below 1 are raised to 1
     */
    public LruCache(Loader<V> loader, int capacity) {
        if (loader == null) {
            throw new IllegalArgumentException("loader must not be null");
        }
        if (capacity < 1) {
            LOGGER.warn("Cache capacity " + capacity + " raised to 1");
            capacity = 1;
        }
        this.loader = loader;
        this.keys = new int[capacity];
        this.occupied = new boolean[capacity];
        this.values = new Object[capacity];
        this.ranks = new long[capacity];
    }

    /**
     * Return the object for {@code key}, loading it into the least recently
     * used slot if it is not cached.
     *
     * If the loader throws, the exception reaches the caller and the cache is
     * left exactly as it was.
     */
    @SuppressWarnings("unchecked")
    public V get(int key) throws IOException {
        int slot = find(key);
        if (slot >= 0) {
            hitCount++;
        } else {
            slot = leastRecentlyUsed();
            V loaded = loader.load(key);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Loaded key " + key + " into slot " + slot
                        + (occupied[slot] ? " (evicted key " + keys[slot] + ")" : ""));
            }
            keys[slot] = key;
            values[slot] = loaded;
            occupied[slot] = true;
            loadCount++;
        }
        ranks[slot] = ++counter;
        return (V) values[slot];
    }

    /**
     * Check whether {@code key} is cached, without touching its recency.
     */
    public boolean contains(int key) {
        return find(key) >= 0;
    }

    /** Drop every cached object. Ranks restart from zero. */
    public void clear() {
        for (int i = 0; i < values.length; i++) {
            values[i] = null;
            occupied[i] = false;
            ranks[i] = 0;
        }
        counter = 0;
    }

    public int capacity() {
        return values.length;
    }

    public int size() {
        int n = 0;
        for (boolean used : occupied) {
            if (used) {
                n++;
            }
        }
        return n;
    }

    /** Number of {@link #get} calls answered from the cache. */
    public long getHitCount() {
        return hitCount;
    }

    /** Number of times the loader was invoked successfully. */
    public long getLoadCount() {
        return loadCount;
    }

    private int find(int key) {
        for (int i = 0; i < keys.length; i++) {
            if (occupied[i] && keys[i] == key) {
                return i;
            }
        }
        return -1;
    }

    private int leastRecentlyUsed() {
        int slot = 0;
        for (int i = 1; i < ranks.length; i++) {
            if (ranks[i] < ranks[slot]) {
                slot = i;
            }
        }
        return slot;
    }
}
