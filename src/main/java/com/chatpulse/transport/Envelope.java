package com.chatpulse.transport;

import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Internal message contract between the runtime and the transport. This is not the
 * proprietary wire format; the transport maps it onto whatever the server speaks.
 *
 * <p>{@code timestamp} is epoch milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Envelope {

    private String type;
    private Map<String, Object> data;
    private String id;
    private long timestamp;

    public static Envelope of(String type, Map<String, Object> data, long timestamp) {
        return new Envelope(type, data, UUID.randomUUID().toString(), timestamp);
    }

    /** Returns {@code data[key]} as a string, or null when absent. */
    public String dataString(String key) {
        if (data == null) {
            return null;
        }
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    /** Returns {@code data[key]} as a long, or null when absent or not numeric. */
    public Long dataLong(String key) {
        if (data == null) {
            return null;
        }
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
