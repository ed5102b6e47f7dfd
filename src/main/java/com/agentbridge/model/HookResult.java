package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a hook request, rendered to JSON by the hook controller.
 */
@Data
@AllArgsConstructor
public class HookResult {
    private int status;
    private String message;

    public static HookResult ok() {
        return new HookResult(200, "OK");
    }

    public static HookResult badRequest(String message) {
        return new HookResult(400, message);
    }

    public static HookResult serverError(String message) {
        return new HookResult(500, message);
    }

    public boolean isOk() {
        return status == 200;
    }
}
