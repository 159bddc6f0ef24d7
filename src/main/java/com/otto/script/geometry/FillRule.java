package com.otto.script.geometry;

/** Decides which regions of overlapping contours count as inside. */
public enum FillRule {
    NON_ZERO {
        @Override
        public boolean isFilled(int winding) {
            return winding != 0;
        }
    },
    EVEN_ODD {
        @Override
        public boolean isFilled(int winding) {
            return (winding & 1) != 0;
        }
    };

    public abstract boolean isFilled(int winding);
}
