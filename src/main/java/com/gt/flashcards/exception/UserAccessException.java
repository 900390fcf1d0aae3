package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a request touches a card, note, tag or deck owned by another user
@ResponseStatus(value = HttpStatus.FORBIDDEN)
public class UserAccessException extends RuntimeException {

    public UserAccessException(String msg) {
        super(msg);
    }

    public UserAccessException(String msg, Exception ex) {
        super(msg, ex);
    }
}
