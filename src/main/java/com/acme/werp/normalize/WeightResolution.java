package com.acme.werp.normalize;

import java.util.List;

public record WeightResolution(List<Double> weights, boolean percent, boolean renormalized, boolean defaulted) {}
