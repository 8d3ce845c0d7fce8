package com.modelsync.core.model;

/**
 * Direction of a port, inferred from its side.
 */
public enum PortDirection {
    INPUT,
    OUTPUT
}
