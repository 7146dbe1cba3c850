package info.isaksson.erland.onemodel.model;

/** Number formatting shared by every generated artifact so values print identically everywhere. */
public final class Numbers {

    private Numbers() {}

    /**
     * Integral values print without a fraction ({@code 0}, {@code 3}); everything else uses
     * {@link Double#toString(double)} ({@code 0.5}, {@code 1.0E-8}).
     */
    public static String format(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (Double.isInfinite(v)) return v > 0 ? "Inf" : "-Inf";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
