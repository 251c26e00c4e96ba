package com.tennis.core.format;

public record IndicatorsView(Integer serving, boolean setPoint, boolean matchPoint, boolean breakPoint) {
}
