package com.ecoWasteEngine.store.firestore;

import com.google.api.core.ApiFuture;
import com.ecoWasteEngine.exception.PickupConflictException;
import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.exception.ServiceException;

import java.util.concurrent.ExecutionException;

/** Blocking wait on a Firestore future with the project's error mapping. */
final class FirestoreCalls {

    private FirestoreCalls() {
    }

    static <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot " + action + ": operation interrupted", e);
        } catch (ExecutionException e) {
            // exceptions thrown inside a transaction function come back wrapped
            Throwable cause = e.getCause();
            if (cause instanceof PickupConflictException
                    || cause instanceof ResourceNotFoundException
                    || cause instanceof IllegalStateException) {
                throw (RuntimeException) cause;
            }
            throw new ServiceException("Cannot " + action, e.getCause());
        }
    }
}
