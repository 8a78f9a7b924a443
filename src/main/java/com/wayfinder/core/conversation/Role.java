package com.wayfinder.core.conversation;

public enum Role {
    USER, ASSISTANT
}
