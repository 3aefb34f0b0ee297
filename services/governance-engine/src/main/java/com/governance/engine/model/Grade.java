package com.governance.engine.model;

public enum Grade {
    A, B, C, D, F
}
