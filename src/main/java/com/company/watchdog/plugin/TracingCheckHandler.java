package com.company.watchdog.plugin;

import com.company.watchdog.domain.CheckResult;
import com.company.watchdog.domain.enums.CheckStatus;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default handler: logs every outcome and records it as a span, with a span event for BAD checks.
 * An {@code owner} entry in the checker's extra config is copied onto the span.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TracingCheckHandler implements CheckHandler {

    static final String OWNER_KEY = "owner";

    private final Tracer tracer;

    @Override
    public void handle(CheckResult result, Map<String, Object> extraConfig) {
        Span span = tracer.spanBuilder("dwmon.check")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("checker.name", result.getCheckerName());
            span.setAttribute("check.minute_epoch", result.getMinuteEpoch());
            span.setAttribute("check.event_count", result.getEventCount());
            span.setAttribute("check.min_required", result.getMinRequired());
            span.setAttribute("check.max_allowed", result.getMaxAllowed());
            span.setAttribute("check.lookback_seconds", result.getLookbackSeconds());
            span.setAttribute("check.status", result.getStatus().name());

            Object owner = extraConfig != null ? extraConfig.get(OWNER_KEY) : null;
            if (owner != null) {
                span.setAttribute("checker.owner", owner.toString());
            }

            if (result.getStatus() == CheckStatus.BAD) {
                span.addEvent("Event count out of bounds",
                        Attributes.of(
                                AttributeKey.longKey("event_count"), result.getEventCount(),
                                AttributeKey.longKey("min_required"), result.getMinRequired(),
                                AttributeKey.longKey("max_allowed"), result.getMaxAllowed()));
                span.setStatus(StatusCode.ERROR, "Check failed");

                log.warn("BAD check for {} at {}: {} events in last {}s (expected {}..{})",
                        result.getCheckerName(), result.getMinuteLocalTime(), result.getEventCount(),
                        result.getLookbackSeconds(), result.getMinRequired(), result.getMaxAllowed());
            } else {
                log.info("GOOD check for {} at {}: {} events in last {}s",
                        result.getCheckerName(), result.getMinuteLocalTime(),
                        result.getEventCount(), result.getLookbackSeconds());
            }
        } finally {
            span.end();
        }
    }
}
