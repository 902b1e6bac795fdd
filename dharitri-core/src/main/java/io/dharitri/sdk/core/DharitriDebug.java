// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Switches for the {@code io.dharitri.debug} trace output, one per {@link Channel}.
 *
 * <p>
 * All channels start off unless the {@value #PROPERTY} system property names
 * them at class load, as a comma-separated list such as {@code request,tx} or
 * {@code all}. Changes made at runtime are visible to every thread.
 *
 * @see DebugLogger
 */
public final class DharitriDebug {

    /** System property read once when this class initializes. */
    public static final String PROPERTY = "dharitri.debug";

    /** Kinds of trace output. */
    public enum Channel {
        /** Each HTTP exchange with the gateway and each failed request. */
        REQUEST,
        /** Broadcasts, returned hashes, poll ticks and final poll states. */
        TX,
        /** In-place retries of idempotent reads. */
        RETRY,
        /** Block generation calls against a chain simulator. */
        SIMULATOR
    }

    private static volatile Set<Channel> enabled = parse(System.getProperty(PROPERTY));

    private DharitriDebug() {
    }

    /** Returns whether any channel is on. */
    public static boolean isEnabled() {
        return !enabled.isEmpty();
    }

    public static boolean isEnabled(final Channel channel) {
        return enabled.contains(channel);
    }

    /** Turns every channel on or off. */
    public static void setEnabled(final boolean on) {
        enabled = on ? EnumSet.allOf(Channel.class) : EnumSet.noneOf(Channel.class);
    }

    public static synchronized void enable(final Channel channel) {
        final EnumSet<Channel> next = EnumSet.noneOf(Channel.class);
        next.addAll(enabled);
        next.add(channel);
        enabled = next;
    }

    public static synchronized void disable(final Channel channel) {
        final EnumSet<Channel> next = EnumSet.noneOf(Channel.class);
        next.addAll(enabled);
        next.remove(channel);
        enabled = next;
    }

    /**
     * Replaces the enabled channels with those named in {@code spec}.
     *
     * @param spec comma-separated channel names, {@code all}, or {@code null}/blank for none
     * @throws IllegalArgumentException if a name is not a channel
     */
    public static void configure(final String spec) {
        enabled = parse(spec);
    }

    static Set<Channel> parse(final String spec) {
        final EnumSet<Channel> channels = EnumSet.noneOf(Channel.class);
        if (spec == null || spec.isBlank()) {
            return channels;
        }
        for (String part : spec.split(",")) {
            final String name = part.trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (name.equals("ALL")) {
                return EnumSet.allOf(Channel.class);
            }
            try {
                channels.add(Channel.valueOf(name));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown debug channel '" + part.trim() + "' in " + PROPERTY, e);
            }
        }
        return channels;
    }
}
