package com.cmdiag.patterns.event;

import com.cmdiag.patterns.model.Pattern;

public record PatternRegisteredEvent(Pattern pattern) {
}
