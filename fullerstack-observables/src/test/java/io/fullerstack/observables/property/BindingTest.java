package io.fullerstack.observables.property;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingTest {

    @Test
    void shouldReadThroughBinding() {
        Property<String> property = new Property<>("start");
        List<String> log = new ArrayList<>();

        try (Binding<String> binding = property.bind(log::add)) {
            property.set("next");

            assertThat(binding.get()).isEqualTo("next");
            assertThat(binding.isActive()).isTrue();
        }
        assertThat(log).containsExactly("next");
    }

    @Test
    void shouldNotEchoWriteToWritingBinding() {
        Property<Integer> property = new Property<>(0);
        List<Integer> writerLog = new ArrayList<>();
        List<Integer> readerLog = new ArrayList<>();

        try (MutableBinding<Integer> writer = property.bindMutable(writerLog::add);
             Binding<Integer> reader = property.bind(readerLog::add)) {
            writer.set(4);
            property.set(5);

            assertThat(reader.get()).isEqualTo(5);
        }

        assertThat(writerLog).containsExactly(5);
        assertThat(readerLog).containsExactly(4, 5);
    }

    @Test
    void shouldUpdateThroughBindingWithoutEcho() {
        Property<Integer> property = new Property<>(1);
        List<Integer> writerLog = new ArrayList<>();
        List<Integer> otherLog = new ArrayList<>();

        try (MutableBinding<Integer> writer = property.bindMutable(writerLog::add);
             Binding<Integer> other = property.bind(otherLog::add)) {
            int result = writer.update(value -> value * 10);

            assertThat(result).isEqualTo(10);
            assertThat(other.get()).isEqualTo(10);
        }

        assertThat(writerLog).isEmpty();
        assertThat(otherLog).containsExactly(10);
    }

    @Test
    void shouldSynchronizeTwoPropertiesWithoutLooping() {
        Property<String> model = new Property<>("");
        Property<String> view = new Property<>("");
        List<MutableBinding<String>> bindings = new ArrayList<>();

        // Each side forwards into the other through a binding that does not hear its own writes
        AtomicReference<MutableBinding<String>> toView = new AtomicReference<>();
        AtomicReference<MutableBinding<String>> toModel = new AtomicReference<>();
        toView.set(view.bindMutable(value -> toModel.get().set(value)));
        toModel.set(model.bindMutable(value -> toView.get().set(value)));
        bindings.add(toView.get());
        bindings.add(toModel.get());

        model.set("typed in model");
        assertThat(view.get()).isEqualTo("typed in model");

        view.set("typed in view");
        assertThat(model.get()).isEqualTo("typed in view");

        bindings.forEach(MutableBinding::release);
    }

    @Test
    void shouldRejectUseAfterRelease() {
        Property<Integer> property = new Property<>(0);
        MutableBinding<Integer> binding = property.bindMutable(value -> { });

        binding.release();
        binding.release();

        assertThat(binding.isActive()).isFalse();
        assertThatThrownBy(binding::get).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> binding.set(1)).isInstanceOf(IllegalStateException.class);
        assertThat(property.get()).isZero();
    }

    @Test
    void shouldDeactivateWhenPropertyClosed() {
        Property<Integer> property = new Property<>(0);
        Binding<Integer> binding = property.bind(value -> { });

        property.close();

        assertThat(binding.isActive()).isFalse();
        assertThatThrownBy(binding::get)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no longer active");
    }
}
