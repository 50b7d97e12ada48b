package com.easyinstall.backup.model;

import lombok.Value;

/**
 * Pushed once when a background operation finishes.
 */
@Value
public class CompletionEvent {
    String operationId;
    boolean success;
    String output;
}
