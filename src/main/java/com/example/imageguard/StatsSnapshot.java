package com.example.imageguard;

public record StatsSnapshot(
        int folders,
        long admitted,
        long rejected,
        long succeeded,
        long failed
) {
}
