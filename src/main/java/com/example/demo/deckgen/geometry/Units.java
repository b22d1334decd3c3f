package com.example.demo.deckgen.geometry;

/**
 * Length conversions. An English Metric Unit is 1/360,000 cm: 914,400 per inch,
 * 12,700 per point. A CSS pixel is 0.75pt.
 */
public final class Units {
    public static final double EMU_PER_POINT = 12_700;
    public static final double EMU_PER_PIXEL = 9_525;
    public static final double POINTS_PER_PIXEL = 0.75;

    private Units() {
    }

    public static double emuToPoints(double emu) {
        return emu / EMU_PER_POINT;
    }

    public static double pointsToEmu(double points) {
        return points * EMU_PER_POINT;
    }

    public static double pixelsToPoints(double px) {
        return px * POINTS_PER_PIXEL;
    }

    public static double pointsToPixels(double points) {
        return points / POINTS_PER_PIXEL;
    }

    public static double pixelsToEmu(double px) {
        return px * EMU_PER_PIXEL;
    }
}
