package com.modelsync.core.model;

/**
 * Width and height of a diagram element.
 *
 * @param width element width
 * @param height element height
 */
public record Dimension(double width, double height) {

    public boolean isPositive() {
        return width > 0 && height > 0;
    }
}
