package uk.ac.ntu.gfs.master;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.ntu.gfs.common.net.PeerClient;
import uk.ac.ntu.gfs.common.net.PeerResponse;
import uk.ac.ntu.gfs.common.protocol.ChunkInfo;
import uk.ac.ntu.gfs.common.protocol.Json;
import uk.ac.ntu.gfs.common.protocol.Protocol;
import uk.ac.ntu.gfs.master.db.Db;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MasterServerTest {

    private MasterServer server;
    private PeerClient http;
    private String address;

    @BeforeEach
    void setUp() throws Exception {
        server = MasterServer.start(MasterConfig.defaults(0));
        http = new PeerClient(Duration.ofSeconds(5));
        address = "localhost:" + server.port();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private String url(String path, String param, String value) {
        return PeerClient.url(address, path, param, value);
    }

    @Test
    void testMissingParametersAre400() throws Exception {
        assertEquals(400, http.post("http://" + address + Protocol.REGISTER).status());
        assertEquals(400, http.post("http://" + address + Protocol.CREATE).status());
        assertEquals(400, http.post("http://" + address + Protocol.ALLOCATE).status());
        assertEquals(400, http.get("http://" + address + Protocol.CHUNKS).status());
    }

    @Test
    void testCreateConflictIs409() throws Exception {
        assertEquals(200, http.post(url(Protocol.CREATE, "file", "/a.txt")).status());
        PeerResponse again = http.post(url(Protocol.CREATE, "file", "/a.txt"));
        assertEquals(409, again.status());
        assertTrue(again.text().startsWith("CONFLICT"), again.text());
    }

    @Test
    void testUnknownFileIs404() throws Exception {
        assertEquals(404, http.get(url(Protocol.CHUNKS, "file", "/missing")).status());
        assertEquals(404, http.post(url(Protocol.ALLOCATE, "file", "/missing")).status());
    }

    @Test
    void testAllocateWithoutServersIs503() throws Exception {
        http.post(url(Protocol.CREATE, "file", "/a.txt"));
        assertEquals(503, http.post(url(Protocol.ALLOCATE, "file", "/a.txt")).status());
    }

    @Test
    void testWriteEndpointsRejectGet() throws Exception {
        assertEquals(405, http.get(url(Protocol.REGISTER, "server", "localhost:9")).status());
        assertEquals(405, http.get(url(Protocol.CREATE, "file", "/a")).status());
        assertEquals(405, http.get(url(Protocol.ALLOCATE, "file", "/a")).status());
    }

    @Test
    void testAllocateAndListAsJson() throws Exception {
        http.post(url(Protocol.REGISTER, "server", "localhost:9001"));
        http.post(url(Protocol.REGISTER, "server", "localhost:9001"));
        http.post(url(Protocol.REGISTER, "server", "localhost:9002"));
        http.post(url(Protocol.CREATE, "file", "/dir/a b.txt"));

        PeerResponse alloc = http.post(url(Protocol.ALLOCATE, "file", "/dir/a b.txt")).orThrow();
        ChunkInfo chunk = Json.chunk(alloc.body());
        assertEquals(List.of("localhost:9001", "localhost:9002"), chunk.servers());
        assertEquals("localhost:9001", chunk.primary());

        PeerResponse list = http.get(url(Protocol.CHUNKS, "file", "/dir/a b.txt")).orThrow();
        assertEquals(List.of(chunk), Json.chunkList(list.body()));

        assertEquals(2, server.master().registeredServers().size());
    }

    @Test
    void testEmptyFileListsAsEmptyArray() throws Exception {
        http.post(url(Protocol.CREATE, "file", "/empty"));
        PeerResponse list = http.get(url(Protocol.CHUNKS, "file", "/empty")).orThrow();
        assertEquals("[]", list.text());
    }

    @Test
    void testHealthAndVersion() throws Exception {
        assertEquals(200, http.get("http://" + address + Protocol.HEALTH).status());
        assertTrue(http.get("http://" + address + Protocol.VERSION).text().startsWith("minigfs"));
    }

    @Test
    void testUnreadableJournalFailsStartupWithIOException(@TempDir Path dir) throws Exception {
        String db = dir.resolve("meta.db").toString();
        try (Connection c = Db.sqlite(db); Statement st = c.createStatement()) {
            st.executeUpdate("CREATE TABLE chunks (handle TEXT PRIMARY KEY)");
        }

        IOException e = assertThrows(IOException.class,
                () -> MasterServer.start(MasterConfig.defaults(0).withDbPath(db)));
        assertTrue(e.getMessage().contains("meta.db"), e.getMessage());
    }
}
