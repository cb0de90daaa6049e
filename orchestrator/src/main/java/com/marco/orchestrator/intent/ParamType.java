package com.marco.orchestrator.intent;

/**
 * Declared type of an action parameter.
 */
public enum ParamType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT
}
