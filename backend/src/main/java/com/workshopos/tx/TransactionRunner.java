package com.workshopos.tx;

import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import org.hibernate.Session;

import java.util.function.Function;

/**
 * Runs a block in its own write transaction and fires the block's post-commit
 * callbacks after the commit returns.
 *
 * Must be the outermost transaction: joining a caller's transaction would run
 * the callbacks before that caller commits.
 */
@Singleton
public class TransactionRunner {

    private final TransactionOperations<Session> transactionOperations;

    public TransactionRunner(TransactionOperations<Session> transactionOperations) {
        this.transactionOperations = transactionOperations;
    }

    public <T> T inTransaction(Function<UnitOfWork, T> work) {
        UnitOfWork unit = new UnitOfWork();
        T result;
        try {
            result = transactionOperations.executeWrite(status -> {
                if (!status.isNewTransaction()) {
                    throw new IllegalStateException("TransactionRunner cannot join an existing transaction");
                }
                return work.apply(unit);
            });
        } catch (RuntimeException e) {
            unit.rolledBack();
            throw e;
        }
        unit.committed();
        return result;
    }
}
