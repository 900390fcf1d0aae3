package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// The card store rejected or rolled back the transaction. Nothing from the operation was applied.
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class TransactionFailureException extends RuntimeException {

    public TransactionFailureException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
