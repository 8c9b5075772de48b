package com.quillkv.audit;

import com.quillkv.store.SchemaCapabilities;
import com.quillkv.store.StoreContext;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcEventLogTest {

    @Test
    void logInsertsAuditRow() throws Exception {
        var ps = mock(PreparedStatement.class);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var events = new JdbcEventLog(new StoreContext(ds, SchemaCapabilities.none(), "owner-1", 0));
        events.log("login_success", Map.of("email", "a@x.com"));

        verify(conn).prepareStatement("INSERT INTO user_logs (event, details) VALUES (?, ?::jsonb)");
        verify(ps).setString(1, "login_success");
        verify(ps).setString(2, "{\"email\":\"a@x.com\"}");
        verify(ps).executeUpdate();
        verify(conn).close();
    }

    @Test
    void ownerColumnIsFilledWhenPresent() throws Exception {
        var ps = mock(PreparedStatement.class);
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var events = new JdbcEventLog(new StoreContext(ds, new SchemaCapabilities(false, true), "owner-1", 0));
        events.log("logout");

        verify(conn).prepareStatement("INSERT INTO user_logs (event, details, user_id) VALUES (?, ?::jsonb, ?)");
        verify(ps).setString(2, "{}");
        verify(ps).setString(3, "owner-1");
    }

    @Test
    void backendFailuresNeverReachTheCaller() throws Exception {
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new SQLException("refused", "08001"));
        var events = new JdbcEventLog(new StoreContext(ds, SchemaCapabilities.none(), "owner-1", 0));

        assertDoesNotThrow(() -> events.log("login_failure", Map.of("email", "x")));
    }

    @Test
    void statementFailureStillReleasesConnection() throws Exception {
        var ps = mock(PreparedStatement.class);
        when(ps.executeUpdate()).thenThrow(new SQLException("relation \"user_logs\" does not exist", "42P01"));
        var conn = mock(Connection.class);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);
        var events = new JdbcEventLog(new StoreContext(ds, SchemaCapabilities.none(), "owner-1", 0));

        assertDoesNotThrow(() -> events.log("logout"));
        verify(ps).close();
        verify(conn).close();
    }
}
