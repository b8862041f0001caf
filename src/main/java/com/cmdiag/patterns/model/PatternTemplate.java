package com.cmdiag.patterns.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Catalog entry: a named signature plus the confidence a scan must reach
 * before the match is reported.
 */
@Value
@Builder
@Jacksonized
public class PatternTemplate {

    String id;
    String name;
    String description;
    PatternType type;
    PatternSignature signature;
    double minConfidence;
}
