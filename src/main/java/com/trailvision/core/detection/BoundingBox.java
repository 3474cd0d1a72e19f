package com.trailvision.core.detection;

public record BoundingBox(double x1, double y1, double x2, double y2) {
}
