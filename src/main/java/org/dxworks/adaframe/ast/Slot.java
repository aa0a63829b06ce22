package org.dxworks.adaframe.ast;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Outcome of a field or child access. Three states are kept apart:
 * <ul>
 *   <li>{@link State#UNAVAILABLE}: the access does not apply (wrong kind, bad index);</li>
 *   <li>{@link State#EMPTY}: the access applies but the syntactic slot is empty;
 *       the value is then {@link Node#NULL};</li>
 *   <li>{@link State#PRESENT}: the access applies and yields a value.</li>
 * </ul>
 * Callers used to out-parameters can rely on {@link #into} and {@link #orElse},
 * which leave the caller's value alone when the slot is unavailable.
 */
public final class Slot<T> {

    public enum State {
        UNAVAILABLE,
        EMPTY,
        PRESENT
    }

    private final State state;
    private final T value;
    private final SlotError error;

    private Slot(State state, T value, SlotError error) {
        this.state = state;
        this.value = value;
        this.error = error;
    }

    public static <T> Slot<T> present(T value) {
        return new Slot<>(State.PRESENT, Objects.requireNonNull(value, "value"), null);
    }

    static Slot<Node> empty() {
        return new Slot<>(State.EMPTY, Node.NULL, null);
    }

    public static <T> Slot<T> unavailable(SlotError error) {
        return new Slot<>(State.UNAVAILABLE, null, Objects.requireNonNull(error, "error"));
    }

    public State state() {
        return state;
    }

    /**
     * Whether the access succeeded, with or without a value.
     */
    public boolean isAvailable() {
        return state != State.UNAVAILABLE;
    }

    public boolean isEmpty() {
        return state == State.EMPTY;
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    /**
     * @return why the slot is unavailable, or empty if it is available
     */
    public Optional<SlotError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the value; {@link Node#NULL} for an empty node slot
     * @throws NoSuchElementException if the slot is unavailable
     */
    public T get() {
        if (state == State.UNAVAILABLE) {
            throw new NoSuchElementException("slot is unavailable: " + error);
        }
        return value;
    }

    /**
     * Hands the value, possibly {@link Node#NULL}, to {@code out} if the slot is available.
     *
     * @return false, without calling {@code out}, if the slot is unavailable
     */
    public boolean into(Consumer<? super T> out) {
        if (state == State.UNAVAILABLE) {
            return false;
        }
        out.accept(value);
        return true;
    }

    /**
     * @return the value if available, otherwise {@code previous}
     */
    public T orElse(T previous) {
        return state == State.UNAVAILABLE ? previous : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot<?> that = (Slot<?>) o;
        return state == that.state && Objects.equals(value, that.value) && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value, error);
    }

    @Override
    public String toString() {
        switch (state) {
            case UNAVAILABLE:
                return "Slot.unavailable(" + error + ")";
            case EMPTY:
                return "Slot.empty";
            default:
                return "Slot.present(" + value + ")";
        }
    }
}
