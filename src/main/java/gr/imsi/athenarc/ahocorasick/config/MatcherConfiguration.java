package gr.imsi.athenarc.ahocorasick.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Tuning knobs for a {@link gr.imsi.athenarc.ahocorasick.matcher.Matcher}.
 * None of them change match results.
 */
public class MatcherConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(MatcherConfiguration.class);

    public static final String RESOURCE = "/ahocorasick.properties";
    public static final String POOL_CAPACITY_KEY = "ahocorasick.pool.capacity";
    public static final String INITIAL_HIT_CAPACITY_KEY = "ahocorasick.hits.initialCapacity";

    public static final int DEFAULT_POOL_CAPACITY = 64;
    public static final int DEFAULT_INITIAL_HIT_CAPACITY = 8;

    private final int poolCapacity;
    private final int initialHitCapacity;

    private MatcherConfiguration(int poolCapacity, int initialHitCapacity) {
        this.poolCapacity = poolCapacity;
        this.initialHitCapacity = initialHitCapacity;
    }

    public static MatcherConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from {@value #RESOURCE} on the classpath, falling back to
     * the defaults when the resource is absent.
     */
    public static MatcherConfiguration load() {
        try (InputStream input = MatcherConfiguration.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOG.warn("No {} found on the classpath, using defaults.", RESOURCE);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(input);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
    }

    public static MatcherConfiguration fromProperties(Properties properties) {
        Preconditions.checkNotNull(properties, "Properties must not be null.");
        Builder builder = builder();
        String poolCapacity = properties.getProperty(POOL_CAPACITY_KEY);
        if (poolCapacity != null) {
            builder.poolCapacity(parseInt(POOL_CAPACITY_KEY, poolCapacity));
        }
        String initialHitCapacity = properties.getProperty(INITIAL_HIT_CAPACITY_KEY);
        if (initialHitCapacity != null) {
            builder.initialHitCapacity(parseInt(INITIAL_HIT_CAPACITY_KEY, initialHitCapacity));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    /**
     * Maximum number of idle dedup tables kept for thread-safe matching.
     */
    public int getPoolCapacity() {
        return poolCapacity;
    }

    public int getInitialHitCapacity() {
        return initialHitCapacity;
    }

    @Override
    public String toString() {
        return "MatcherConfiguration{poolCapacity=" + poolCapacity
            + ", initialHitCapacity=" + initialHitCapacity + "}";
    }

    public static class Builder {
        private int poolCapacity = DEFAULT_POOL_CAPACITY;
        private int initialHitCapacity = DEFAULT_INITIAL_HIT_CAPACITY;

        public Builder poolCapacity(int poolCapacity) {
            this.poolCapacity = poolCapacity;
            return this;
        }

        public Builder initialHitCapacity(int initialHitCapacity) {
            this.initialHitCapacity = initialHitCapacity;
            return this;
        }

        public MatcherConfiguration build() {
            Preconditions.checkArgument(poolCapacity > 0, "Pool capacity must be positive: %s", poolCapacity);
            Preconditions.checkArgument(initialHitCapacity >= 0,
                "Initial hit capacity must not be negative: %s", initialHitCapacity);
            return new MatcherConfiguration(poolCapacity, initialHitCapacity);
        }
    }
}
