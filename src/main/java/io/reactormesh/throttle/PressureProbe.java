package io.reactormesh.throttle;

/**
 * A source of infrastructure pressure in {@code [0, 1]}.
 */
public interface PressureProbe {
    String name();

    double pressure();
}
