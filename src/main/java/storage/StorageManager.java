package storage;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 클래스
 * <p>
 * 같은 키에 대한 읽기-수정-쓰기는 {@link ConcurrentHashMap#compute} 안에서 한 번에 수행되므로
 * 키 단위로 원자적입니다. 서로 다른 키는 서로를 막지 않습니다.
 * 만료된 키는 접근 시점의 lazy 검사와 주기적인 sweep 두 경로로 제거됩니다.
 */
@Slf4j
public class StorageManager {

    public static final long NO_TTL = -1L;
    public static final long DEFAULT_SWEEP_INTERVAL_MILLIS = 100L;

    private final ConcurrentHashMap<String, StoredEntry> data = new ConcurrentHashMap<>();
    // keys that carry a TTL, mapped to the exact entry instance that carries it
    private final ConcurrentHashMap<String, StoredEntry> expiring = new ConcurrentHashMap<>();
    private final Object moveLock = new Object();
    private final LongSupplier clock;
    private final long sweepIntervalMillis;

    private ScheduledExecutorService sweeper;

    public StorageManager() {
        this(DEFAULT_SWEEP_INTERVAL_MILLIS);
    }

    public StorageManager(long sweepIntervalMillis) {
        this(System::currentTimeMillis, sweepIntervalMillis);
    }

    StorageManager(LongSupplier clock, long sweepIntervalMillis) {
        if (sweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("sweepIntervalMillis must be > 0");
        }
        this.clock = clock;
        this.sweepIntervalMillis = sweepIntervalMillis;
    }

    /**
     * 백그라운드 만료 sweep 을 시작합니다. 이미 실행 중이면 아무것도 하지 않습니다.
     */
    public synchronized void startExpirySweeper() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "redis-expiry-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        sweeper.scheduleWithFixedDelay(this::sweep, sweepIntervalMillis, sweepIntervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * sweep 을 멈추고 모든 데이터를 비웁니다. 여러 번 호출해도 안전합니다.
     */
    public synchronized void shutdown() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        flushAll();
    }

    private void sweep() {
        try {
            int removed = purgeExpired();
            if (removed > 0) {
                log.debug("Expiry sweep removed {} key(s)", removed);
            }
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task for good
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * 만료된 키를 모두 제거하고 제거된 개수를 반환합니다.
     */
    public int purgeExpired() {
        long now = clock.getAsLong();
        int removed = 0;
        for (Map.Entry<String, StoredEntry> candidate : expiring.entrySet()) {
            StoredEntry entry = candidate.getValue();
            if (entry.isExpired(now) && evict(candidate.getKey(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    // ----- strings -----

    public boolean set(String key, String value) {
        return set(key, value, NO_TTL, false, false);
    }

    /**
     * 문자열 값을 저장합니다. 기존 값의 종류와 TTL 은 무시하고 덮어씁니다.
     *
     * @param ttlMillis 0 이상이면 TTL(ms), {@link #NO_TTL} 이면 만료 없음
     * @return nx/xx 조건 때문에 쓰지 않았으면 false
     */
    public boolean set(String key, String value, long ttlMillis, boolean nx, boolean xx) {
        if (nx && xx) {
            throw new IllegalArgumentException("NX and XX are mutually exclusive");
        }
        AtomicBoolean written = new AtomicBoolean(false);
        mutate(key, (current, now) -> {
            if ((nx && current != null) || (xx && current == null)) {
                return current;
            }
            written.set(true);
            return new StoredEntry(StoredValue.ofString(value), expiresAt(now, ttlMillis));
        });
        return written.get();
    }

    public String get(String key) {
        StoredEntry entry = getLive(key);
        return entry == null ? null : entry.getValue().asString();
    }

    /**
     * 문자열 값을 정수로 보고 delta 만큼 더합니다. 없는 키는 0 에서 시작하며 기존 TTL 은 유지됩니다.
     */
    public long incrBy(String key, long delta) {
        AtomicLong result = new AtomicLong();
        mutate(key, (current, now) -> {
            long base = current == null
                    ? 0L
                    : parseInteger(current.getValue().asString(), NotAnIntegerException.VALUE_MESSAGE);
            long updated = addExact(base, delta);
            result.set(updated);
            long expiry = current == null ? StoredEntry.NO_EXPIRY : current.getExpiresAt();
            return new StoredEntry(StoredValue.ofString(String.valueOf(updated)), expiry);
        });
        return result.get();
    }

    // ----- keyspace -----

    /**
     * 키들을 삭제하고, 삭제 직전에 만료되지 않은 상태로 존재했던 키의 개수를 반환합니다.
     */
    public long del(String... keys) {
        long now = clock.getAsLong();
        long count = 0;
        for (String key : keys) {
            StoredEntry removed = data.remove(key);
            if (removed != null) {
                expiring.remove(key, removed);
                if (!removed.isExpired(now)) {
                    count++;
                }
            }
        }
        return count;
    }

    public long exists(String... keys) {
        long count = 0;
        for (String key : keys) {
            if (getLive(key) != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * 키에 저장된 값의 종류를 반환합니다. 없으면 null.
     */
    public ValueType type(String key) {
        StoredEntry entry = getLive(key);
        return entry == null ? null : entry.getValue().type();
    }

    /**
     * glob 패턴에 맞는 살아있는 키 목록을 반환합니다.
     */
    public List<String> keys(String pattern) {
        Pattern regex = GlobPattern.compile(pattern);
        long now = clock.getAsLong();
        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, StoredEntry> entry : data.entrySet()) {
            if (!entry.getValue().isExpired(now) && regex.matcher(entry.getKey()).matches()) {
                matches.add(entry.getKey());
            }
        }
        return matches;
    }

    /**
     * 만료되지 않은 키의 개수
     */
    public long liveKeyCount() {
        long now = clock.getAsLong();
        return data.values().stream().filter(entry -> !entry.isExpired(now)).count();
    }

    /**
     * 물리적으로 남아있는 항목 수 (아직 제거되지 않은 만료 키 포함)
     */
    public int size() {
        return data.size();
    }

    public void flushAll() {
        for (String key : data.keySet()) {
            StoredEntry removed = data.remove(key);
            if (removed != null) {
                expiring.remove(key, removed);
            }
        }
    }

    /**
     * 키의 TTL 을 지금부터 ttlMillis 로 바꿉니다. 0 이하이면 키를 바로 삭제합니다.
     *
     * @return 키가 존재했으면 true
     */
    public boolean expire(String key, long ttlMillis) {
        if (ttlMillis <= 0) {
            return del(key) > 0;
        }
        AtomicBoolean updated = new AtomicBoolean(false);
        mutate(key, (current, now) -> {
            if (current == null) {
                return null;
            }
            updated.set(true);
            return new StoredEntry(current.getValue(), expiresAt(now, ttlMillis));
        });
        return updated.get();
    }

    /**
     * 남은 TTL(ms). 키가 없으면 -2, TTL 이 없으면 -1.
     */
    public long pttl(String key) {
        StoredEntry entry = getLive(key);
        if (entry == null) {
            return -2;
        }
        if (!entry.hasExpiry()) {
            return -1;
        }
        return Math.max(0, entry.getExpiresAt() - clock.getAsLong());
    }

    /**
     * TTL 을 제거합니다. TTL 이 있던 키였으면 true.
     */
    public boolean persist(String key) {
        AtomicBoolean cleared = new AtomicBoolean(false);
        mutate(key, (current, now) -> {
            if (current == null || !current.hasExpiry()) {
                return current;
            }
            cleared.set(true);
            return new StoredEntry(current.getValue(), StoredEntry.NO_EXPIRY);
        });
        return cleared.get();
    }

    // ----- hashes -----

    /**
     * 필드들을 해시에 병합하고 새로 생긴 필드의 개수를 반환합니다.
     */
    public long hset(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return 0;
        }
        AtomicLong added = new AtomicLong();
        mutate(key, (current, now) -> {
            StoredEntry target = current != null ? current : new StoredEntry(StoredValue.newHash(), StoredEntry.NO_EXPIRY);
            ConcurrentHashMap<String, String> hash = target.getValue().asHash();
            for (Map.Entry<String, String> field : fields.entrySet()) {
                if (hash.put(field.getKey(), field.getValue()) == null) {
                    added.incrementAndGet();
                }
            }
            return target;
        });
        return added.get();
    }

    public boolean hsetnx(String key, String field, String value) {
        AtomicBoolean added = new AtomicBoolean(false);
        mutate(key, (current, now) -> {
            StoredEntry target = current != null ? current : new StoredEntry(StoredValue.newHash(), StoredEntry.NO_EXPIRY);
            added.set(target.getValue().asHash().putIfAbsent(field, value) == null);
            return target;
        });
        return added.get();
    }

    public String hget(String key, String field) {
        StoredEntry entry = getLive(key);
        return entry == null ? null : entry.getValue().asHash().get(field);
    }

    /**
     * 필드 순서대로 값을 반환합니다. 없는 필드(또는 없는 키)는 null 입니다.
     */
    public List<String> hmget(String key, List<String> fields) {
        List<String> absent = Collections.nCopies(fields.size(), null);
        return this.<List<String>>readValue(key, value -> {
            // one snapshot under the key lock; a concurrent HSET is seen whole or not at all
            ConcurrentHashMap<String, String> hash = value.asHash();
            List<String> values = new ArrayList<>(fields.size());
            for (String field : fields) {
                values.add(hash.get(field));
            }
            return values;
        }, new ArrayList<>(absent));
    }

    public long hincrBy(String key, String field, long delta) {
        AtomicLong result = new AtomicLong();
        mutate(key, (current, now) -> {
            StoredEntry target = current != null ? current : new StoredEntry(StoredValue.newHash(), StoredEntry.NO_EXPIRY);
            ConcurrentHashMap<String, String> hash = target.getValue().asHash();
            String existing = hash.get(field);
            long base = existing == null ? 0L : parseInteger(existing, NotAnIntegerException.HASH_VALUE_MESSAGE);
            long updated = addExact(base, delta);
            hash.put(field, String.valueOf(updated));
            result.set(updated);
            return target;
        });
        return result.get();
    }

    // ----- lists -----

    /**
     * 값들을 인자 순서대로 head 에 넣습니다. {@code lpush k a b c} 는 c, b, a 가 됩니다.
     */
    public long lpush(String key, String... values) {
        return push(key, true, values);
    }

    public long rpush(String key, String... values) {
        return push(key, false, values);
    }

    private long push(String key, boolean head, String... values) {
        if (values.length == 0) {
            return llen(key);
        }
        AtomicLong length = new AtomicLong();
        mutate(key, (current, now) -> {
            StoredEntry target = current != null ? current : new StoredEntry(StoredValue.newList(), StoredEntry.NO_EXPIRY);
            ArrayDeque<String> items = target.getValue().asList();
            for (String value : values) {
                if (head) {
                    items.addFirst(value);
                } else {
                    items.addLast(value);
                }
            }
            length.set(items.size());
            return target;
        });
        return length.get();
    }

    public String lpop(String key) {
        return pop(key, true);
    }

    public String rpop(String key) {
        return pop(key, false);
    }

    private String pop(String key, boolean head) {
        return pop(key, head, new AtomicLong());
    }

    /**
     * @param expiry 꺼낸 항목의 만료 시각을 받습니다
     */
    private String pop(String key, boolean head, AtomicLong expiry) {
        AtomicReference<String> popped = new AtomicReference<>();
        mutate(key, (current, now) -> {
            if (current == null) {
                return null;
            }
            ArrayDeque<String> items = current.getValue().asList();
            popped.set(head ? items.pollFirst() : items.pollLast());
            expiry.set(current.getExpiresAt());
            return items.isEmpty() ? null : current;
        });
        return popped.get();
    }

    public long llen(String key) {
        return this.<Long>readList(key, items -> (long) items.size(), 0L);
    }

    /**
     * 호출 시점 스냅샷에서 [start, stop] 범위를 반환합니다. 음수 인덱스는 끝에서부터 셉니다.
     */
    public List<String> lrange(String key, long start, long stop) {
        List<String> snapshot = this.<List<String>>readList(key, items -> new ArrayList<>(items), null);
        if (snapshot == null) {
            return Collections.emptyList();
        }
        int[] range = clampRange(snapshot.size(), start, stop);
        if (range == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(snapshot.subList(range[0], range[1] + 1));
    }

    /**
     * [start, stop] 범위만 남깁니다. 남는 원소가 없으면 키를 삭제합니다.
     */
    public void ltrim(String key, long start, long stop) {
        mutate(key, (current, now) -> {
            if (current == null) {
                return null;
            }
            ArrayDeque<String> items = current.getValue().asList();
            int[] range = clampRange(items.size(), start, stop);
            if (range == null) {
                return null;
            }
            List<String> kept = new ArrayList<>(items).subList(range[0], range[1] + 1);
            items.clear();
            items.addAll(kept);
            return current;
        });
    }

    /**
     * source 의 head/tail 에서 원소 하나를 꺼내 destination 의 head/tail 에 넣습니다.
     * source 가 비어 있으면 null 을 반환하고 아무것도 바꾸지 않습니다.
     */
    public String lmove(String source, String destination, boolean fromLeft, boolean toLeft) {
        // TODO: replace the single move lock with ordered per-key locking if LMOVE traffic ever contends
        synchronized (moveLock) {
            if (source.equals(destination)) {
                return rotate(source, fromLeft, toLeft);
            }
            StoredEntry src = getLive(source);
            if (src == null) {
                return null;
            }
            // type checks before anything moves
            src.getValue().asList();
            StoredEntry dst = getLive(destination);
            if (dst != null) {
                dst.getValue().asList();
            }

            AtomicLong sourceExpiry = new AtomicLong(StoredEntry.NO_EXPIRY);
            String element = pop(source, fromLeft, sourceExpiry);
            if (element == null) {
                return null;
            }
            try {
                push(destination, toLeft, element);
            } catch (WrongTypeException e) {
                // destination changed type between the check and the push
                restore(source, fromLeft, element, sourceExpiry.get());
                throw e;
            }
            return element;
        }
    }

    /**
     * 꺼냈던 원소를 원래 자리에 되돌립니다. pop 으로 키가 지워졌다면 원래 만료 시각으로 다시 만듭니다.
     */
    void restore(String key, boolean head, String element, long expiresAt) {
        mutate(key, (current, now) -> {
            StoredEntry target = current != null ? current : new StoredEntry(StoredValue.newList(), expiresAt);
            ArrayDeque<String> items = target.getValue().asList();
            if (head) {
                items.addFirst(element);
            } else {
                items.addLast(element);
            }
            return target;
        });
    }

    private String rotate(String key, boolean fromLeft, boolean toLeft) {
        AtomicReference<String> moved = new AtomicReference<>();
        mutate(key, (current, now) -> {
            if (current == null) {
                return null;
            }
            ArrayDeque<String> items = current.getValue().asList();
            String element = fromLeft ? items.pollFirst() : items.pollLast();
            if (toLeft) {
                items.addFirst(element);
            } else {
                items.addLast(element);
            }
            moved.set(element);
            return current;
        });
        return moved.get();
    }

    /**
     * 음수 인덱스를 변환하고 범위를 잘라 [start, stop] 을 반환합니다. 빈 범위면 null.
     */
    static int[] clampRange(int size, long start, long stop) {
        if (start < 0) {
            start += size;
        }
        if (stop < 0) {
            stop += size;
        }
        if (start < 0) {
            start = 0;
        }
        if (start >= size || start > stop) {
            return null;
        }
        if (stop >= size) {
            stop = size - 1;
        }
        return new int[]{(int) start, (int) stop};
    }

    // ----- internals -----

    @FunctionalInterface
    private interface Mutation {
        /**
         * @param current 만료되지 않은 현재 항목, 없으면 null
         * @return 새 항목, null 이면 키 삭제
         */
        StoredEntry apply(StoredEntry current, long now);
    }

    /**
     * 키 하나에 대한 읽기-수정-쓰기를 원자적으로 수행합니다.
     * mutation 이 예외를 던지면 저장소는 바뀌지 않습니다.
     */
    private void mutate(String key, Mutation mutation) {
        data.compute(key, (k, existing) -> {
            long now = clock.getAsLong();
            StoredEntry current = existing == null || existing.isExpired(now) ? null : existing;
            StoredEntry next = mutation.apply(current, now);
            track(k, next);
            return next;
        });
    }

    private <T> T readList(String key, Function<ArrayDeque<String>, T> reader, T absent) {
        return readValue(key, value -> reader.apply(value.asList()), absent);
    }

    /**
     * 값을 키 잠금 안에서 읽습니다. 없는 키면 absent 를 반환합니다.
     */
    private <T> T readValue(String key, Function<StoredValue, T> reader, T absent) {
        AtomicReference<T> result = new AtomicReference<>(absent);
        data.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(clock.getAsLong())) {
                expiring.remove(k, existing);
                return null;
            }
            result.set(reader.apply(existing.getValue()));
            return existing;
        });
        return result.get();
    }

    // must run inside the compute() of the same key
    private void track(String key, StoredEntry entry) {
        if (entry != null && entry.hasExpiry()) {
            expiring.put(key, entry);
        } else {
            expiring.remove(key);
        }
    }

    private StoredEntry getLive(String key) {
        StoredEntry entry = data.get(key);
        if (entry != null && entry.isExpired(clock.getAsLong())) {
            evict(key, entry);
            return null;
        }
        return entry;
    }

    private boolean evict(String key, StoredEntry entry) {
        if (data.remove(key, entry)) {
            expiring.remove(key, entry);
            return true;
        }
        // a newer entry replaced it; that write already updated the TTL index
        expiring.remove(key, entry);
        return false;
    }

    private static long expiresAt(long now, long ttlMillis) {
        if (ttlMillis < 0) {
            return StoredEntry.NO_EXPIRY;
        }
        long expiresAt = now + ttlMillis;
        return expiresAt < now ? Long.MAX_VALUE : expiresAt;
    }

    private static long parseInteger(String value, String message) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new NotAnIntegerException(message, e);
        }
    }

    private static long addExact(long base, long delta) {
        try {
            return Math.addExact(base, delta);
        } catch (ArithmeticException e) {
            throw new OverflowException(e);
        }
    }
}
