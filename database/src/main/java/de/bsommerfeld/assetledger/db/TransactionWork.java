package de.bsommerfeld.assetledger.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed by {@link ConnectionManager#transaction}.
 *
 * @param <T> result type, {@link Void} for work without a result
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(Connection connection) throws SQLException;
}
