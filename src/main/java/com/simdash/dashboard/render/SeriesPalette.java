package com.simdash.dashboard.render;

/**
 * Fixed trace colours, assigned by monitored-key position.
 */
public final class SeriesPalette {

    private static final String[] COLORS = {
            "#FF0000", // red
            "#0000FF", // blue
            "#008000", // green
            "#FFA500", // orange
            "#800080", // purple
            "#A52A2A", // brown
            "#FFC0CB", // pink
            "#00FFFF"  // cyan
    };

    private SeriesPalette() {
    }

    public static String colorFor(int keyIndex) {
        return COLORS[Math.floorMod(keyIndex, COLORS.length)];
    }
}
