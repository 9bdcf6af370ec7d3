package com.flowgraph.flowgraph_engine.model.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Versioned key/value document flowing through one execution.
 *
 * <p>{@code data} is the workflow payload; {@code metadata} is a side channel for
 * diagnostics that nodes write (last LLM call, last tool call, ...). Every payload
 * or metadata mutation bumps {@link #getVersion()} and moves {@link #getUpdatedAt()}
 * strictly forward. Accessors are guarded by a read/write lock so a state can be
 * shared across helper threads; the engine itself never mutates a state in place
 * and works on {@link #copy()}s instead.
 */
public class GraphState {

    public static final String FIELD_ID         = "id";
    public static final String FIELD_GRAPH_ID   = "graph_id";
    public static final String FIELD_USER_ID    = "user_id";
    public static final String FIELD_SESSION_ID = "session_id";
    public static final String FIELD_DATA       = "data";
    public static final String FIELD_METADATA   = "metadata";
    public static final String FIELD_CREATED_AT = "created_at";
    public static final String FIELD_UPDATED_AT = "updated_at";
    public static final String FIELD_VERSION    = "version";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final String id;
    private final String graphId;
    private String userId;
    private String sessionId;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private Instant updatedAt;
    private long version;

    public GraphState(String id, String graphId) {
        this(id, graphId, null, null, new LinkedHashMap<>(), new LinkedHashMap<>(), Instant.now(), null, 1L);
    }

    private GraphState(String id, String graphId, String userId, String sessionId,
                       Map<String, Object> data, Map<String, Object> metadata,
                       Instant createdAt, Instant updatedAt, long version) {
        this.id = Objects.requireNonNull(id, "state id");
        this.graphId = graphId;
        this.userId = userId;
        this.sessionId = sessionId;
        this.data = data;
        this.metadata = metadata;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
        this.version = version;
    }

    // ── Identity ──────────────────────────────────────────────────────────────

    public String getId() { return id; }

    public String getGraphId() { return graphId; }

    public Instant getCreatedAt() { return createdAt; }

    public String getUserId() {
        lock.readLock().lock();
        try {
            return userId;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setUserId(String userId) {
        lock.writeLock().lock();
        try {
            this.userId = userId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String getSessionId() {
        lock.readLock().lock();
        try {
            return sessionId;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setSessionId(String sessionId) {
        lock.writeLock().lock();
        try {
            this.sessionId = sessionId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Instant getUpdatedAt() {
        lock.readLock().lock();
        try {
            return updatedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getVersion() {
        lock.readLock().lock();
        try {
            return version;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Payload reads ─────────────────────────────────────────────────────────

    /** Value stored under {@code key}. A key holding an explicit null reads as empty; use {@link #has}. */
    public Optional<Object> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(data.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Value under {@code key} if present and assignable to {@code type}. */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public Optional<String> getString(String key) {
        return get(key, String.class);
    }

    /** Any integral or floating number, truncated to an int. */
    public Optional<Integer> getInteger(String key) {
        return get(key, Number.class).map(Number::intValue);
    }

    public Optional<Boolean> getBoolean(String key) {
        return get(key, Boolean.class);
    }

    @SuppressWarnings("unchecked")
    public Optional<List<Object>> getList(String key) {
        return get(key).filter(List.class::isInstance).map(v -> (List<Object>) v);
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getMap(String key) {
        return get(key).filter(Map.class::isInstance).map(v -> (Map<String, Object>) v);
    }

    public boolean has(String key) {
        lock.readLock().lock();
        try {
            return data.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Payload keys in insertion order. */
    public List<String> keys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(data.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Deep copy of the payload; callers may mutate it freely. */
    public Map<String, Object> snapshot() {
        lock.readLock().lock();
        try {
            return StateValues.deepCopyMap(data);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Payload writes ────────────────────────────────────────────────────────

    public void set(String key, Object value) {
        lock.writeLock().lock();
        try {
            data.put(key, value);
            touch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Applies all entries under a single write lock and a single version bump. */
    public void setMultiple(Map<String, ?> values) {
        lock.writeLock().lock();
        try {
            data.putAll(values);
            touch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String key) {
        lock.writeLock().lock();
        try {
            data.remove(key);
            touch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ── Metadata ──────────────────────────────────────────────────────────────

    public void setMetadata(String key, Object value) {
        lock.writeLock().lock();
        try {
            metadata.put(key, value);
            touch();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Object> getMetadata(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(metadata.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> metadataSnapshot() {
        lock.readLock().lock();
        try {
            return StateValues.deepCopyMap(metadata);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Copy / document form ──────────────────────────────────────────────────

    /** Fully independent deep copy; same id, version and timestamps. */
    public GraphState copy() {
        lock.readLock().lock();
        try {
            return new GraphState(id, graphId, userId, sessionId,
                    StateValues.deepCopyMap(data), StateValues.deepCopyMap(metadata),
                    createdAt, updatedAt, version);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * JSON-shaped document form: {@code {id, graph_id, user_id?, session_id?, data,
     * metadata, created_at, updated_at, version}} with ISO-8601 timestamps.
     */
    public Map<String, Object> toDocument() {
        lock.readLock().lock();
        try {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put(FIELD_ID, id);
            doc.put(FIELD_GRAPH_ID, graphId);
            if (userId != null) doc.put(FIELD_USER_ID, userId);
            if (sessionId != null) doc.put(FIELD_SESSION_ID, sessionId);
            doc.put(FIELD_DATA, StateValues.deepCopyMap(data));
            doc.put(FIELD_METADATA, StateValues.deepCopyMap(metadata));
            doc.put(FIELD_CREATED_AT, createdAt.toString());
            doc.put(FIELD_UPDATED_AT, updatedAt.toString());
            doc.put(FIELD_VERSION, version);
            return doc;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Inverse of {@link #toDocument()}; timestamps may be ISO-8601 strings or epoch millis. */
    @SuppressWarnings("unchecked")
    public static GraphState fromDocument(Map<String, ?> doc) {
        Object id = doc.get(FIELD_ID);
        if (!(id instanceof String) || ((String) id).isBlank()) {
            throw new IllegalArgumentException("state document has no id");
        }
        Object rawData = doc.get(FIELD_DATA);
        Object rawMetadata = doc.get(FIELD_METADATA);
        Instant createdAt = toInstant(doc.get(FIELD_CREATED_AT), Instant.now());
        Object rawVersion = doc.get(FIELD_VERSION);
        return new GraphState(
                (String) id,
                stringField(doc, FIELD_GRAPH_ID),
                stringField(doc, FIELD_USER_ID),
                stringField(doc, FIELD_SESSION_ID),
                rawData instanceof Map ? StateValues.deepCopyMap((Map<String, ?>) rawData) : new LinkedHashMap<>(),
                rawMetadata instanceof Map ? StateValues.deepCopyMap((Map<String, ?>) rawMetadata) : new LinkedHashMap<>(),
                createdAt,
                toInstant(doc.get(FIELD_UPDATED_AT), createdAt),
                rawVersion instanceof Number n ? n.longValue() : 1L);
    }

    private static String stringField(Map<String, ?> doc, String field) {
        Object raw = doc.get(field);
        if (raw == null || raw instanceof String) return (String) raw;
        throw new IllegalArgumentException("state document field " + field + " must be a string");
    }

    private static Instant toInstant(Object raw, Instant fallback) {
        if (raw instanceof Instant instant) return instant;
        if (raw instanceof String s && !s.isBlank()) return Instant.parse(s);
        if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
        return fallback;
    }

    // Caller holds the write lock.
    private void touch() {
        version++;
        Instant now = Instant.now();
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plusNanos(1);
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "GraphState{id='" + id + "', graphId='" + graphId + "', version=" + version
                    + ", keys=" + data.keySet() + "}";
        } finally {
            lock.readLock().unlock();
        }
    }
}
