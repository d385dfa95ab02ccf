package com.acme.werp.normalize;

import com.acme.werp.model.Assessment;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.model.Finding;

import java.util.List;
import java.util.Set;

public record NormalizationResult(Assessment assessment, List<Finding> diagnostics, Set<SectionKind> corrected) {}
