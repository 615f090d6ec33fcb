package io.fullerstack.observables;

import io.fullerstack.observables.config.ObservablesConfig;
import io.fullerstack.observables.event.Event;
import io.fullerstack.observables.property.Property;
import io.fullerstack.observables.property.PropertyOptions;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Factory for events and properties whose defaults come from {@link ObservablesConfig}.
 *
 * <pre>{@code
 * Event<String> saved = Observables.event("saved");
 * Property<Integer> count = Observables.property("count", 0);
 * }</pre>
 *
 * <p>Use the constructors directly to bypass configuration.
 */
@UtilityClass
public class Observables {

    public <T> Event<T> event(String name) {
        return event(name, ObservablesConfig.global());
    }

    public <T> Event<T> event(String name, ObservablesConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return new Event<>(name, config.failurePolicy());
    }

    public <T> Property<T> property(String name, T initial) {
        return property(name, initial, ObservablesConfig.global());
    }

    public <T> Property<T> property(String name, T initial, ObservablesConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        PropertyOptions options = PropertyOptions.from(config).toBuilder()
            .name(name)
            .build();
        return new Property<>(initial, options);
    }
}
