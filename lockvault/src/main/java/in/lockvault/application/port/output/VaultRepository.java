package in.lockvault.application.port.output;

import java.util.function.Function;

/**
 * Storage boundary for all vault state.
 *
 * Every public vault operation runs inside exactly one {@link #inTransaction} call. Writers are
 * serialized; a runtime exception thrown by the work rolls back every mutation it made and is
 * rethrown unchanged.
 */
public interface VaultRepository {

    /**
     * Run mutating work atomically. After-commit hooks registered on the transaction run only if
     * the work completes and the commit succeeds.
     */
    <T> T inTransaction(Function<VaultTransaction, T> work);

    /**
     * Run a query against a consistent snapshot. Mutating calls on the view throw
     * {@link IllegalStateException}.
     */
    <T> T readOnly(Function<VaultTransaction, T> query);
}
