package com.acme.werp.model;

import java.util.List;

/** corrected is true when the section was scale-corrected or weight-renormalized. */
public record NormalizedSection<S>(S section, boolean corrected, List<Finding> findings) {}
