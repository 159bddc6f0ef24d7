package com.otto.script.runtime;

import com.otto.script.model.ColorTable;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Color resolution and fill/opacity defaults for shape parameters. */
final class ShapeStyling {

    private static final Set<String> COLOR_KEYS = new HashSet<>(Arrays.asList(
            "color", "fillcolor", "strokecolor", "fill", "stroke", "background", "border"));

    private ShapeStyling() {}

    static boolean isColorKey(String key) {
        return COLOR_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }

    /** Named colors in color-bearing properties become hex; anything else passes through. */
    static Value normalize(String key, Value value) {
        if (value.isString() && isColorKey(key)) {
            return Value.string(ColorTable.resolve(value.asString()));
        }
        return value;
    }

    static void applyFillDefaults(ShapeType type, Map<String, Value> params) {
        Value fill = params.get("fill");
        Value filled = params.get("filled");

        if (fill != null && fill.isString()) {
            params.putIfAbsent("fillColor", fill);
            params.put("fill", Value.bool(true));
        } else if (isTrue(fill) || isTrue(filled)) {
            params.put("fill", Value.bool(true));
            if (!params.containsKey("fillColor")) {
                Value color = params.get("color");
                params.put("fillColor", color != null && color.isString() ? color : Value.string(ColorTable.DEFAULT_FILL));
            }
        } else if (params.containsKey("fillColor") && !isFalse(fill)) {
            params.put("fill", Value.bool(true));
        }

        Value strokeColor = params.get("strokeColor");
        if (strokeColor != null && strokeColor.isString()) {
            params.put("strokeColor", Value.string(ColorTable.resolve(strokeColor.asString())));
        }

        if (params.containsKey("alpha") && !params.containsKey("opacity")) {
            params.put("opacity", params.get("alpha"));
        }

        if (type == ShapeType.TEXT && !params.containsKey("fill") && !params.containsKey("fillColor")) {
            params.put("fill", Value.bool(true));
            params.put("fillColor", Value.string(ColorTable.DEFAULT_TEXT_FILL));
        }
    }

    private static boolean isTrue(Value v) {
        return v != null && v.type == Value.Type.BOOL && v.asBool();
    }

    private static boolean isFalse(Value v) {
        return v != null && v.type == Value.Type.BOOL && !v.asBool();
    }
}
