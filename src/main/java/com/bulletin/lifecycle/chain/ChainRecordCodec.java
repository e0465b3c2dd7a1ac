package com.bulletin.lifecycle.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * JSON codec and content hasher for chain records.
 *
 * <p>Encoding is canonical: properties are sorted and timestamps are written as
 * ISO-8601 strings, so the same record always produces the same bytes. Decoding
 * ignores unknown properties, which keeps old readers working when fields are
 * added to a payload.</p>
 *
 * <p>The record hash is the SHA-256 of the canonical encoding of
 * {@code (author, createdAt, payload, previousHash)}. A root record has no
 * predecessor yet when it is hashed, so {@value #ROOT_MARKER} stands in for it.</p>
 *
 * @param <T> payload type
 */
public class ChainRecordCodec<T> {

    static final String ROOT_MARKER = "ROOT";

    private final ObjectMapper mapper;
    private final JavaType recordType;

    public ChainRecordCodec(Class<T> payloadType) {
        this.mapper = createMapper();
        this.recordType = mapper.getTypeFactory().constructParametricType(ChainRecord.class, payloadType);
    }

    static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Computes the content hash of a record.
     *
     * @param previousHash the superseded record, or null for a chain root
     */
    public String computeHash(String previousHash, String author, Instant createdAt, T payload) {
        ObjectNode node = mapper.createObjectNode();
        node.put("author", author);
        node.put("createdAt", createdAt.toString());
        node.set("payload", mapper.valueToTree(payload));
        node.put("previousHash", previousHash != null ? previousHash : ROOT_MARKER);
        try {
            return sha256(mapper.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode record for hashing", e);
        }
    }

    /**
     * Recomputes the hash of a stored record and compares it with the one it carries.
     */
    public boolean verify(ChainRecord<T> record) {
        String previous = record.isRoot() ? null : record.previousHash();
        return record.hash().equals(computeHash(previous, record.author(), record.createdAt(), record.payload()));
    }

    public byte[] encode(ChainRecord<T> record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode record " + record.hash(), e);
        }
    }

    public ChainRecord<T> decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, recordType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode chain record: "
                    + new String(bytes, StandardCharsets.UTF_8), e);
        }
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
