package com.quillkv.store;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

final class SqlErrors {

    private SqlErrors() {}

    static StoreException translate(String message, SQLException e) {
        return isUnavailable(e)
                ? new BackendUnavailableException(message, e)
                : new BackendException(message, e);
    }

    // Transient covers connection acquisition timeouts and cancelled statements (SQLTimeoutException).
    static boolean isUnavailable(SQLException e) {
        if (e instanceof SQLTransientException
                || e instanceof SQLNonTransientConnectionException
                || e instanceof SQLRecoverableException) {
            return true;
        }
        var state = e.getSQLState();
        return state != null && (state.startsWith("08") || "57014".equals(state));
    }
}
