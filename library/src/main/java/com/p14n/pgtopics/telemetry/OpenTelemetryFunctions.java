package com.p14n.pgtopics.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        public static final String TRACEPARENT = "traceparent";

        private OpenTelemetryFunctions() {
        }

        /**
         * @return the W3C traceparent of the current span, or null outside a trace
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(TRACEPARENT);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put(TRACEPARENT, traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new MapGetter());
        }

        /**
         * Runs the action in a span named {@code spanName}, parented on the
         * traceparent when one is given. Exceptions are recorded on the span and
         * rethrown.
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String topic,
                        String eventId, String traceparent, Callable<T> action) throws Exception {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("topic", topic);
                if (eventId != null) {
                        sb.setAttribute("event.id", eventId);
                }
                if (traceparent != null) {
                        sb.setParent(deserializeTraceContext(ot, traceparent));
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.call();
                } catch (Exception e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }

        static class MapGetter implements TextMapGetter<Map<String, String>> {
                @Override
                public String get(Map<String, String> carrier, String key) {
                        return carrier == null ? null : carrier.get(key);
                }

                @Override
                public Iterable<String> keys(Map<String, String> carrier) {
                        return carrier.keySet();
                }
        }
}
