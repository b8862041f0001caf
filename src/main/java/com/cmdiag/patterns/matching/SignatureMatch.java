package com.cmdiag.patterns.matching;

import com.cmdiag.patterns.model.TemplateMatchContext;

/**
 * Outcome of evaluating one signature against one window.
 */
public record SignatureMatch(boolean matches, double score, TemplateMatchContext context) {
}
