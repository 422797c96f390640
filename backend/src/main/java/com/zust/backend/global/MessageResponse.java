package com.zust.backend.global;

/** {"message": "..."} body of endpoints that only confirm an action. */
public record MessageResponse(String message) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
