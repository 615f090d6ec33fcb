package io.fullerstack.observables.property;

import io.fullerstack.observables.config.ObservablesConfig;
import io.fullerstack.observables.registry.FailurePolicy;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Construction options for a {@link Property}.
 *
 * <pre>{@code
 * PropertyOptions options = PropertyOptions.builder()
 *     .name("volume")
 *     .distinct(true)
 *     .build();
 * Property<Integer> volume = new Property<>(5, options);
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public class PropertyOptions {

    /** Name used in log messages. */
    @NonNull
    @Builder.Default
    private final String name = "property";

    /** When true, a write equal to the current value stores nothing and notifies nobody. */
    @Builder.Default
    private final boolean distinct = false;

    @NonNull
    @Builder.Default
    private final FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

    public static PropertyOptions defaults() {
        return builder().build();
    }

    /**
     * Reads {@code property.distinct} and {@code registry.failure-policy} from configuration.
     *
     * @param config the configuration to read
     * @return options with configured defaults
     */
    public static PropertyOptions from(ObservablesConfig config) {
        return builder()
            .distinct(config.getBoolean(ObservablesConfig.PROPERTY_DISTINCT, false))
            .failurePolicy(config.failurePolicy())
            .build();
    }
}
