package com.structcheck.common.material;

/**
 * Unit conversions between the core's SI base units (N, N·mm, mm) and the
 * units used by reporting (tonf, tonf·m, kN, kN·m).
 */
public final class Units {

    /** 1 tonf = 1000 kg × 9.80665 m/s². */
    public static final double TONF_TO_N = 9806.65;

    /** 1 tonf·m in N·mm. */
    public static final double TONFM_TO_NMM = 9_806_650.0;

    public static final double KN_TO_N = 1000.0;
    public static final double KNM_TO_NMM = 1_000_000.0;

    private Units() {}

    public static double toTonf(double newtons) {
        return newtons / TONF_TO_N;
    }

    public static double toTonfM(double newtonMillimetres) {
        return newtonMillimetres / TONFM_TO_NMM;
    }

    public static double fromTonf(double tonf) {
        return tonf * TONF_TO_N;
    }

    public static double fromTonfM(double tonfM) {
        return tonfM * TONFM_TO_NMM;
    }

    public static double toKn(double newtons) {
        return newtons / KN_TO_N;
    }

    public static double toKnM(double newtonMillimetres) {
        return newtonMillimetres / KNM_TO_NMM;
    }
}
