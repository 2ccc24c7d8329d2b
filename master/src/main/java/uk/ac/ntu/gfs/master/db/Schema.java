package uk.ac.ntu.gfs.master.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class Schema {
    private Schema() {}

    public static void ensure(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {

            s.executeUpdate("""
                CREATE TABLE IF NOT EXISTS servers (
                  address TEXT PRIMARY KEY
                )
            """);

            s.executeUpdate("""
                CREATE TABLE IF NOT EXISTS files (
                  name TEXT PRIMARY KEY,
                  size INTEGER NOT NULL
                )
            """);

            s.executeUpdate("""
                CREATE TABLE IF NOT EXISTS file_chunks (
                  file_name TEXT NOT NULL,
                  chunk_index INTEGER NOT NULL,
                  handle TEXT NOT NULL,
                  PRIMARY KEY (file_name, chunk_index)
                )
            """);

            s.executeUpdate("""
                CREATE TABLE IF NOT EXISTS chunks (
                  handle TEXT PRIMARY KEY,
                  servers TEXT NOT NULL,
                  version INTEGER NOT NULL,
                  size INTEGER NOT NULL,
                  primary_server TEXT NOT NULL,
                  lease_end TEXT NOT NULL
                )
            """);
        }
    }
}
