package pe.soapros.httptrace.core.domain;

import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Case-insensitive view over request or response headers.
 * <p>
 * HTTP header names are case-insensitive (RFC 9110), so lookups and writes are
 * keyed by the lower-cased name while the name as first written is kept for
 * {@link #asMap()}. A carrier lives as long as the request it belongs to.
 */
public final class HeaderCarrier {

    /**
     * Reads propagation headers from a carrier.
     */
    public static final TextMapGetter<HeaderCarrier> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HeaderCarrier carrier) {
            return carrier.names();
        }

        @Override
        public String get(HeaderCarrier carrier, String key) {
            return carrier == null ? null : carrier.get(key);
        }
    };

    /**
     * Writes propagation headers into a carrier.
     */
    public static final TextMapSetter<HeaderCarrier> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.set(key, value);
        }
    };

    private final Map<String, Entry> headers = new LinkedHashMap<>();

    private HeaderCarrier() {
    }

    public static HeaderCarrier empty() {
        return new HeaderCarrier();
    }

    public static HeaderCarrier of(Map<String, String> headers) {
        HeaderCarrier carrier = new HeaderCarrier();
        if (headers != null) {
            headers.forEach(carrier::putIfAbsent);
        }
        return carrier;
    }

    /**
     * Builds a carrier from a multi-valued header map; only the first value of
     * each header is kept.
     */
    public static HeaderCarrier ofMulti(Map<String, List<String>> headers) {
        HeaderCarrier carrier = new HeaderCarrier();
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (values != null && !values.isEmpty()) {
                    carrier.putIfAbsent(name, values.get(0));
                }
            });
        }
        return carrier;
    }

    public String get(String name) {
        if (name == null) {
            return null;
        }
        Entry entry = headers.get(normalize(name));
        return entry == null ? null : entry.value;
    }

    public void set(String name, String value) {
        if (name == null || value == null) {
            return;
        }
        headers.put(normalize(name), new Entry(name, value));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(headers.keySet());
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    /**
     * Copy of the headers keyed by their original spelling.
     */
    public Map<String, String> asMap() {
        Map<String, String> copy = new LinkedHashMap<>();
        headers.values().forEach(entry -> copy.put(entry.name, entry.value));
        return copy;
    }

    private void putIfAbsent(String name, String value) {
        if (name != null && value != null) {
            headers.putIfAbsent(normalize(name), new Entry(name, value));
        }
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "HeaderCarrier" + headers.keySet();
    }

    private static final class Entry {
        private final String name;
        private final String value;

        private Entry(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }
}
