package com.tennis.core.format;

/**
 * Display label, color and icon for a match status.
 */
public record StatusView(String label, String color, String icon, boolean live) {
}
