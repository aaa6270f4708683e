package com.netbet.bybit.stream;

import java.io.IOException;

/** No inbound traffic within the liveness threshold. Triggers a reconnect, never reaches callers. */
public class StaleConnectionException extends IOException {

    public StaleConnectionException(String message) {
        super(message);
    }
}
