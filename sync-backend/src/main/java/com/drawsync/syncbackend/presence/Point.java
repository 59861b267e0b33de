package com.drawsync.syncbackend.presence;

public record Point(double x, double y) {
}
