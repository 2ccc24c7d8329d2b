package uk.ac.ntu.gfs.master.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.protocol.ChunkInfo;
import uk.ac.ntu.gfs.master.core.FileRecord;
import uk.ac.ntu.gfs.master.core.MetadataJournal;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SqliteJournal implements MetadataJournal {
    private static final Logger log = LoggerFactory.getLogger(SqliteJournal.class);

    private final String path;

    private SqliteJournal(String path) {
        this.path = path;
    }

    public static SqliteJournal open(String path) throws SQLException {
        try (Connection c = Db.sqlite(path)) {
            Schema.ensure(c);
        }
        log.info("SQLite metadata journal ready at {}", path);
        return new SqliteJournal(path);
    }

    @Override
    public void serverRegistered(String address) {
        try (Connection c = Db.sqlite(path);
             PreparedStatement ps = c.prepareStatement("INSERT OR IGNORE INTO servers(address) VALUES(?)")) {
            ps.setString(1, address);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Journal write failed (server {} kept in memory): {}", address, e.getMessage());
        }
    }

    @Override
    public void fileCreated(String name) {
        try (Connection c = Db.sqlite(path);
             PreparedStatement ps = c.prepareStatement("INSERT OR IGNORE INTO files(name,size) VALUES(?,0)")) {
            ps.setString(1, name);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Journal write failed (file {} kept in memory): {}", name, e.getMessage());
        }
    }

    @Override
    public void chunkAllocated(String file, int index, ChunkInfo chunk) {
        try (Connection c = Db.sqlite(path)) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "REPLACE INTO chunks(handle,servers,version,size,primary_server,lease_end) VALUES(?,?,?,?,?,?)")) {
                    ps.setString(1, chunk.handle());
                    ps.setString(2, String.join(",", chunk.servers()));
                    ps.setInt(3, chunk.version());
                    ps.setLong(4, chunk.size());
                    ps.setString(5, chunk.primary());
                    ps.setString(6, chunk.leaseEnd().toString());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "REPLACE INTO file_chunks(file_name,chunk_index,handle) VALUES(?,?,?)")) {
                    ps.setString(1, file);
                    ps.setInt(2, index);
                    ps.setString(3, chunk.handle());
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.warn("Journal write failed (chunk {} of {} kept in memory): {}", chunk.handle(), file, e.getMessage());
        }
    }

    @Override
    public Snapshot load() {
        try (Connection c = Db.sqlite(path)) {
            return new Snapshot(loadServers(c), loadFiles(c), loadChunks(c));
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load metadata journal " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<String> loadServers(Connection c) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT address FROM servers ORDER BY rowid");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(rs.getString(1));
        }
        return out;
    }

    private static List<FileRecord> loadFiles(Connection c) throws SQLException {
        Map<String, Long> sizes = new LinkedHashMap<>();
        Map<String, List<String>> chunks = new LinkedHashMap<>();

        try (PreparedStatement ps = c.prepareStatement("SELECT name,size FROM files ORDER BY rowid");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                sizes.put(rs.getString(1), rs.getLong(2));
                chunks.put(rs.getString(1), new ArrayList<>());
            }
        }

        try (PreparedStatement ps = c.prepareStatement(
                "SELECT file_name,handle FROM file_chunks ORDER BY file_name,chunk_index");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                List<String> handles = chunks.get(rs.getString(1));
                if (handles != null) handles.add(rs.getString(2));
            }
        }

        List<FileRecord> out = new ArrayList<>(sizes.size());
        sizes.forEach((name, size) -> out.add(new FileRecord(name, chunks.get(name), size)));
        return out;
    }

    private static List<ChunkInfo> loadChunks(Connection c) throws SQLException {
        List<ChunkInfo> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT handle,servers,version,size,primary_server,lease_end FROM chunks");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String servers = rs.getString(2);
                List<String> replicas = servers == null || servers.isBlank()
                        ? List.of()
                        : Arrays.asList(servers.split(","));
                out.add(new ChunkInfo(rs.getString(1), replicas, rs.getInt(3), rs.getLong(4),
                        rs.getString(5), Instant.parse(rs.getString(6))));
            }
        }
        return out;
    }
}
