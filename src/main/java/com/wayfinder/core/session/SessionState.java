package com.wayfinder.core.session;

public enum SessionState {
    ACTIVE, EXPIRED, TERMINATED
}
