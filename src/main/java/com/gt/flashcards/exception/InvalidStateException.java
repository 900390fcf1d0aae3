package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a card is not in the state an operation requires, e.g. repositioning a card that is not new
@ResponseStatus(value = HttpStatus.CONFLICT)
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String msg) {
        super(msg);
    }
}
