package com.cmdiag.patterns.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PatternEventLogger {

    @EventListener
    public void onPatternsFound(PatternsFoundEvent event) {
        log.info("Pattern scan found {} patterns between {} and {}",
                event.count(), event.timeRange().start(), event.timeRange().end());
    }

    @EventListener
    public void onPatternRegistered(PatternRegisteredEvent event) {
        log.info("Pattern registered: {} ({}, confidence: {})",
                event.pattern().getId(), event.pattern().getName(), event.pattern().getConfidencePercent());
    }
}
