package com.easyinstall.backup.service;

import com.easyinstall.backup.model.CompletionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Fan-out of completion events to every connected listener. Events published
 * while nobody listens are dropped.
 */
@Slf4j
@Component
public class NotificationChannel {

    private final Sinks.Many<CompletionEvent> sink = Sinks.many().multicast().directBestEffort();

    public void publish(CompletionEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Completion event {} not delivered: {}", event.getOperationId(), result);
        }
    }

    public Flux<CompletionEvent> events() {
        return sink.asFlux();
    }
}
