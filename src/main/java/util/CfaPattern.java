package util;

import java.util.Locale;

/** 2×2 Bayer color-filter layouts, named by the top-left quad read row by row. */
public enum CfaPattern {
    RGGB(0, 1, 1, 2),
    GRBG(1, 0, 2, 1),
    GBRG(1, 2, 0, 1),
    BGGR(2, 1, 1, 0);

    public static final int RED = 0, GREEN = 1, BLUE = 2;

    private final int[] quad;

    CfaPattern(int topLeft, int topRight, int bottomLeft, int bottomRight) {
        this.quad = new int[] { topLeft, topRight, bottomLeft, bottomRight };
    }

    /** Channel sampled at (x, y): {@link #RED}, {@link #GREEN} or {@link #BLUE}. */
    public int colorAt(int x, int y) {
        return quad[((y & 1) << 1) | (x & 1)];
    }

    public static CfaPattern parse(String s) {
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown CFA pattern: " + s + " (expected RGGB, GRBG, GBRG or BGGR)", e);
        }
    }
}
