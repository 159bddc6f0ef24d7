package com.otto.script.store;

import com.otto.script.model.ShapeRecord;
import com.otto.script.model.ShapeTransform;
import com.otto.script.model.ShapeType;
import com.otto.script.model.Value;

import java.util.Map;

/**
 * Accepts every built-in shape type. Parameters become options with plain Java values;
 * snake_case keys are rewritten to camelCase.
 */
public class DefaultShapeFactory implements ShapeFactory {

    @Override
    public boolean supports(String type) {
        return ShapeType.fromName(type) != null;
    }

    @Override
    public StoredShape create(String name, ShapeRecord shape) {
        StoredShape out = new StoredShape(shape.getId(), name, shape.getType().typeName());
        ShapeTransform t = shape.getTransform();
        out.setPosition(t.getX(), t.getY());
        out.setRotation(t.getRotation());
        out.setScale(t.getScaleX(), t.getScaleY());
        out.setLayer(shape.getLayerName());
        for (Map.Entry<String, Value> e : shape.getParams().entrySet()) {
            out.getOptions().put(camelCase(e.getKey()), e.getValue().toJava());
        }
        return out;
    }

    static String camelCase(String key) {
        if (key.indexOf('_') < 0) return key;
        StringBuilder sb = new StringBuilder(key.length());
        boolean upper = false;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_' && sb.length() > 0) {
                upper = true;
            } else if (c == '_') {
                sb.append(c);
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }
}
