package com.easyinstall.backup.logging;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Carries the submitting thread's MDC into a background thread.
 */
@Slf4j
public class MdcRunnable implements Runnable {
    private final Runnable delegate;
    private final Map<String, String> contextMap;

    public MdcRunnable(Runnable delegate) {
        this(delegate, MDC.getCopyOfContextMap());
    }

    public MdcRunnable(Runnable delegate, Map<String, String> contextMap) {
        this.delegate = delegate;
        this.contextMap = contextMap;
    }

    @Override
    public void run() {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        }
        try {
            delegate.run();
        } finally {
            log.debug("clearing MDC context after execution of {}", Thread.currentThread().getName());
            MDC.clear();
        }
    }
}
