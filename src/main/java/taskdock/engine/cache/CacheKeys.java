package taskdock.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable cache keys from request parameters.
 */
public final class CacheKeys {
    private CacheKeys() {}

    // sorted output so equal maps and beans always hash the same
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    /**
     * Hex SHA-256 of the JSON form of {@code parts}.
     *
     * @throws IllegalArgumentException if a part cannot be serialized
     */
    public static String of(Object... parts) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(parts);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parts are not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** {@code prefix:hash} */
    public static String prefixed(String prefix, Object... parts) {
        String hash = of(parts);
        return prefix == null || prefix.isEmpty() ? hash : prefix + ":" + hash;
    }
}
