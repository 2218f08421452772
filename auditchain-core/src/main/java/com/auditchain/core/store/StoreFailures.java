package com.auditchain.core.store;

import com.auditchain.core.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Maps infrastructure failures of the JPA stores onto {@link StoreUnavailableException}.
 */
final class StoreFailures {

    private StoreFailures() {}

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException
                 | TransientDataAccessException e) {
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        }
    }
}
