package com.otto.script.model;

public enum ConstraintKind {
    COINCIDENT,
    DISTANCE,
    HORIZONTAL,
    VERTICAL
}
