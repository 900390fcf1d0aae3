package com.gt.flashcards.transaction;

import com.gt.flashcards.exception.TransactionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

// Runs card store work in a single transaction. Calls made while a transaction is already open join it,
// so a leech check invoked from a review commits or rolls back together with the review.
@Component
public class CardStoreTransactions {

    private static final Logger log = LoggerFactory.getLogger(CardStoreTransactions.class);

    private final TransactionTemplate transactionTemplate;

    @Autowired
    public CardStoreTransactions(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException ex) {
            String errMsg = "Transaction failed during " + operation;

            log.error(errMsg, ex);
            throw new TransactionFailureException(errMsg, ex);
        }
    }

    public void inTransaction(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }
}
