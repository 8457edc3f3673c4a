package io.keeplast.server.engine;

/**
 * Row-based window frame ending at the current row.
 *
 * @param preceding number of rows before the current row, or -1 for UNBOUNDED PRECEDING
 */
public record WindowFrame(int preceding) {

    public WindowFrame {
        if (preceding < -1) throw new IllegalArgumentException("preceding must be >= 0");
    }

    public static WindowFrame unboundedPreceding() {
        return new WindowFrame(-1);
    }

    public static WindowFrame rowsPreceding(int n) {
        if (n < 0) throw new IllegalArgumentException("preceding must be >= 0");
        return new WindowFrame(n);
    }

    public boolean unbounded() {
        return preceding < 0;
    }

    /** First row index in the frame of row {@code current}. */
    public int startFor(int current) {
        return unbounded() ? 0 : Math.max(0, current - preceding);
    }
}
