package com.cmflineage.model;

public enum EventDirection {
    INPUT,
    OUTPUT
}
