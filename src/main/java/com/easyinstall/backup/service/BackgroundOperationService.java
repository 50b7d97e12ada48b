package com.easyinstall.backup.service;

import com.easyinstall.backup.logging.MdcRunnable;
import com.easyinstall.backup.model.CompletionEvent;
import com.easyinstall.backup.utils.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Runs one long operation on its own thread and announces the outcome on the
 * notification channel. Callers only get the operation id back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackgroundOperationService {

    private final NotificationChannel notificationChannel;

    public String submit(String kind, Callable<String> task) {
        String operationId = UUID.randomUUID().toString();

        Map<String, String> context = MDC.getCopyOfContextMap();
        context = context == null ? new HashMap<>() : new HashMap<>(context);
        context.put(AppConstants.MDC_OPERATION_ID, operationId);

        Thread thread = new Thread(new MdcRunnable(() -> execute(operationId, task), context), kind + "-" + operationId);
        thread.setDaemon(true);
        thread.start();
        log.info("Started background {} operation {}", kind, operationId);
        return operationId;
    }

    private void execute(String operationId, Callable<String> task) {
        CompletionEvent event;
        try {
            event = new CompletionEvent(operationId, true, task.call());
        } catch (Exception e) {
            log.error("Background operation {} failed: {}", operationId, e.getMessage(), e);
            event = new CompletionEvent(operationId, false, e.getMessage());
        }
        notificationChannel.publish(event);
    }
}
