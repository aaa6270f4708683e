package com.netbet.bybit.auth;

import java.io.IOException;

/** Venue rejected the stream authentication, or did not answer in time. */
public class AuthenticationException extends IOException {

    public AuthenticationException(String message) {
        super(message);
    }
}
