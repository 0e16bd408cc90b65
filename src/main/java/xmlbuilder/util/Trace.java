// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import xmlbuilder.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * A user-readable description of an operation in progress, established with try-with-resources.
 * <p>
 * Each thread keeps a stack of open traces. Whoever reports a condition, typically a handler, reads it with
 * {@link #activeTraces()} to tell the user <em>what</em> was being done, for example which element was being
 * serialized, when things went wrong. Traces complement Java stack traces rather than replace them.
 * <p>
 * A trace must be closed by the thread that opened it, in reverse order of opening.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace whose message is computed by {@code supplier} on first use, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Opens a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        this.messageOrSupplier = messageOrSupplier;
        owner = openTraces.get();
        owner.push(this);
    }

    /**
     * Returns a live view of the calling thread's open trace messages, newest first.
     */
    public static Iterable<String> activeTraces() {
        return ActiveTraces.instance;
    }

    /**
     * Returns a copy of the calling thread's open trace messages, newest first.
     */
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        activeTraces().forEach(result::add);
        return result;
    }

    /**
     * Does nothing. Exists so that try-with-resources blocks don't trigger unused-resource warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Closes this trace. Called by try-with-resources, never manually.
     */
    @Override
    public void close() {
        assert owner == openTraces.get() : "Trace closed by a thread other than the one that opened it";
        assert owner.peek() == this : "Traces closed out of order";
        owner.pop();
    }

    private String message() {
        if (messageOrSupplier instanceof final MessageSupplier supplier) {
            final var computed = supplier.get();
            messageOrSupplier = computed;
            return computed;
        }
        return (String) messageOrSupplier;
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<ArrayDeque<Trace>> openTraces = ThreadLocal.withInitial(ArrayDeque::new);

    // Either the message itself or the MessageSupplier that will produce it.
    private Object messageOrSupplier;
    private final ArrayDeque<Trace> owner;

    private static final class ActiveTraces implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            final var traces = openTraces.get().iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return traces.hasNext();
                }

                @Override
                public String next() {
                    return traces.next().message();
                }
            };
        }

        private static final ActiveTraces instance = new ActiveTraces();
    }
}
