package io.recovery.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ServiceLoader-backed lookup of {@link DatabaseVariant} implementations of one kind.
 *
 * @param <T> the variant base type registered under {@code META-INF/services}
 */
public final class VariantRegistry<T extends DatabaseVariant> {

    private final String kind;
    private final List<T> variants;
    private final Map<String, T> byName = new ConcurrentHashMap<>();

    private VariantRegistry(String kind, List<T> variants) {
        this.kind = kind;
        this.variants = variants;
        for (T variant : variants) {
            byName.put(variant.name().toLowerCase(Locale.ROOT), variant);
        }
    }

    /**
     * Loads every registered implementation of {@code type}.
     *
     * @param kind human-readable name used in error messages
     */
    public static <T extends DatabaseVariant> VariantRegistry<T> load(Class<T> type, String kind) {
        List<T> loaded = ServiceLoader.load(type, type.getClassLoader())
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        return new VariantRegistry<>(kind, loaded);
    }

    public List<T> all() {
        return variants;
    }

    /**
     * Gets an implementation by name.
     *
     * @throws IllegalArgumentException if none is registered under {@code name}
     */
    public T get(String name) {
        Objects.requireNonNull(name, "name");
        T variant = byName.get(name.toLowerCase(Locale.ROOT));
        if (variant == null) {
            throw new IllegalArgumentException("Unknown " + kind + ": " + name +
                    ". Available: " + byName.keySet());
        }
        return variant;
    }

    /**
     * Detects the implementation matching the URL of a connection from {@code dataSource}.
     *
     * @throws IllegalStateException if the URL cannot be read
     */
    public T detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect " + kind + " from DataSource", e);
        }
    }

    /**
     * Detects the implementation handling {@code jdbcUrl}.
     *
     * @throws IllegalArgumentException if no registered implementation matches
     */
    public T detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (T variant : variants) {
            for (String prefix : variant.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return variant;
                }
            }
        }
        throw new IllegalArgumentException("No " + kind + " found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private List<String> allPrefixes() {
        return variants.stream()
                .flatMap(v -> v.jdbcUrlPrefixes().stream())
                .toList();
    }
}
