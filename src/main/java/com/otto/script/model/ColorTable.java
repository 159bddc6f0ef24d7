package com.otto.script.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Named color lookup. Hex, rgb() and hsl() strings pass through {@link #resolve(String)} untouched. */
public final class ColorTable {

    public static final String DEFAULT_FILL = "#808080";
    public static final String DEFAULT_TEXT_FILL = "#000000";
    public static final String DEFAULT_STROKE = "#000000";

    private static final Map<String, String> NAMED;
    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("red", "#FF0000");
        map.put("green", "#008000");
        map.put("blue", "#0000FF");
        map.put("yellow", "#FFFF00");
        map.put("orange", "#FFA500");
        map.put("purple", "#800080");
        map.put("pink", "#FFC0CB");
        map.put("brown", "#A52A2A");
        map.put("black", "#000000");
        map.put("white", "#FFFFFF");
        map.put("gray", "#808080");
        map.put("grey", "#808080");
        map.put("lightgray", "#D3D3D3");
        map.put("lightgrey", "#D3D3D3");
        map.put("darkgray", "#A9A9A9");
        map.put("darkgrey", "#A9A9A9");
        map.put("cyan", "#00FFFF");
        map.put("magenta", "#FF00FF");
        map.put("lime", "#00FF00");
        map.put("navy", "#000080");
        map.put("teal", "#008080");
        map.put("silver", "#C0C0C0");
        map.put("gold", "#FFD700");
        map.put("transparent", "transparent");
        NAMED = Collections.unmodifiableMap(map);
    }

    private ColorTable() {}

    public static boolean isNamedColor(String name) {
        return name != null && NAMED.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public static String resolve(String color) {
        if (color == null) return null;
        String hex = NAMED.get(color.trim().toLowerCase(Locale.ROOT));
        return hex != null ? hex : color;
    }
}
