package com.naturalsql.service;

import com.naturalsql.model.ConnectionDescriptor;
import com.naturalsql.model.EngineKind;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Small shop database in a temporary SQLite file.
 */
final class SqliteFixture {

    private SqliteFixture() {
    }

    static ConnectionDescriptor create(Path dir) throws SQLException {
        Path file = dir.resolve("shop.db");
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement st = conn.createStatement()) {
            st.executeUpdate("CREATE TABLE customers (id INTEGER PRIMARY KEY, name TEXT NOT NULL, email TEXT)");
            st.executeUpdate("CREATE TABLE orders (id INTEGER PRIMARY KEY, "
                    + "customer_id INTEGER NOT NULL REFERENCES customers(id), status TEXT, created_at TEXT)");
            st.executeUpdate("INSERT INTO customers (id, name, email) VALUES "
                    + "(1, 'Alice', 'alice@example.com'), (2, 'Bob', NULL)");
            st.executeUpdate("INSERT INTO orders (id, customer_id, status, created_at) VALUES "
                    + "(455, 1, 'open', '2019-03-01'), "
                    + "(456, 1, 'shipped', '2020-06-15'), "
                    + "(457, 2, 'open', date('now'))");
        }
        return ConnectionDescriptor.builder().engine(EngineKind.SQLITE).path(file.toString()).build();
    }
}
