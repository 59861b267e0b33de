package com.drawsync.syncbackend.protocol;

import com.drawsync.syncbackend.presence.Point;
import jakarta.validation.constraints.NotNull;

public record CursorPoint(
        @NotNull(message = "point.x is required") Double x,
        @NotNull(message = "point.y is required") Double y
) {
    public Point toPoint() {
        return new Point(x, y);
    }
}
