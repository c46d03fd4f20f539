package org.hexwar.runtime.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.hexwar.runtime.moves.Change;
import org.hexwar.runtime.moves.MoveResult;

import java.io.IOException;
import java.util.List;

/**
 * Canonical JSON encoding of snapshots, changes and move results.
 * <p>
 * Properties and map entries are written in sorted order, so two equal values always encode
 * to the same bytes. This makes encoded output usable for byte-level determinism checks.
 */
public final class SnapshotCodec {

    private static final TypeReference<List<Change>> CHANGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<MoveResult>> RESULT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build();
    }

    public byte[] encode(GameStateSnapshot snapshot) {
        return write(snapshot, GameStateSnapshot.class);
    }

    /**
     * @throws IOException if the bytes are not a valid snapshot.
     */
    public GameStateSnapshot decode(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, GameStateSnapshot.class);
    }

    public byte[] encodeChanges(List<Change> changes) {
        try {
            return mapper.writerFor(CHANGE_LIST).writeValueAsBytes(changes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode changes", e);
        }
    }

    /**
     * @throws IOException if the bytes are not a valid change list.
     */
    public List<Change> decodeChanges(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, CHANGE_LIST);
    }

    public byte[] encodeResults(List<MoveResult> results) {
        try {
            return mapper.writerFor(RESULT_LIST).writeValueAsBytes(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode move results", e);
        }
    }

    /**
     * @throws IOException if the bytes are not a valid result list.
     */
    public List<MoveResult> decodeResults(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, RESULT_LIST);
    }

    private byte[] write(Object value, Class<?> type) {
        try {
            return mapper.writerFor(type).writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + type.getSimpleName(), e);
        }
    }
}
