package com.easyinstall.backup.model;

import lombok.Value;

@Value
public class CommandResult {
    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String getOutput() {
        return isSuccess() ? stdout : stderr;
    }
}
