package com.titiplex.mist.core.store;

import com.titiplex.mist.core.crypto.LocalSecrets;
import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

@org.springframework.stereotype.Repository
public class SqliteRepository implements Repository {
    private static final Logger log = LoggerFactory.getLogger(SqliteRepository.class);

    private final Connection conn;
    private final LocalSecrets secrets;

    public SqliteRepository(@Value("${app.data.dir}") String dataDir, LocalSecrets secrets) {
        this.secrets = secrets;
        try {
            Files.createDirectories(Path.of(dataDir));
            conn = DriverManager.getConnection("jdbc:sqlite:" + Path.of(dataDir, "mist.sqlite"));
            init();
        } catch (IOException | SQLException e) {
            throw new StoreException("Cannot open database in " + dataDir, e);
        }
    }

    @Override
    public synchronized void init() {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS sessions (" +
                    "peer_key TEXT PRIMARY KEY," +
                    "role TEXT NOT NULL," +
                    "state BLOB NOT NULL," +
                    "version INTEGER NOT NULL," +
                    "updated_at INTEGER NOT NULL" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS contacts (" +
                    "peer_key TEXT PRIMARY KEY," +
                    "display_name TEXT," +
                    "trust_origin TEXT NOT NULL," +
                    "established_at INTEGER NOT NULL" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS signed_prekeys (" +
                    "id INTEGER PRIMARY KEY," +
                    "public_key BLOB NOT NULL," +
                    "private_key BLOB NOT NULL," +   // scellée
                    "signature BLOB NOT NULL," +
                    "created_at INTEGER NOT NULL" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS one_time_prekeys (" +
                    "id INTEGER PRIMARY KEY," +
                    "public_key BLOB NOT NULL," +
                    "private_key BLOB NOT NULL," +   // scellée
                    "reserved INTEGER NOT NULL DEFAULT 0" +
                    ")");
        } catch (SQLException e) {
            throw new StoreException("Schema creation failed", e);
        }
    }

    // ---------- Sessions ----------
    @Override
    public synchronized void saveSession(StoredSession s) {
        // une version plus ancienne n'écrase jamais une plus récente
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO sessions(peer_key,role,state,version,updated_at) VALUES(?,?,?,?,?) " +
                        "ON CONFLICT(peer_key) DO UPDATE SET role=excluded.role, state=excluded.state, " +
                        "version=excluded.version, updated_at=excluded.updated_at " +
                        "WHERE excluded.version > sessions.version")) {
            ps.setString(1, s.peer().urlSafe());
            ps.setString(2, s.role());
            ps.setBytes(3, secrets.seal(s.state()));
            ps.setLong(4, s.version());
            ps.setLong(5, s.updatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot save session for " + s.peer(), e);
        }
    }

    @Override
    public synchronized List<StoredSession> listSessions() {
        List<StoredSession> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT peer_key,role,state,version,updated_at FROM sessions ORDER BY peer_key");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                PeerKey peer = PeerKey.fromUrlSafe(rs.getString(1));
                try {
                    out.add(new StoredSession(peer, rs.getString(2), secrets.open(rs.getBytes(3)),
                            rs.getLong(4), rs.getLong(5)));
                } catch (IllegalStateException e) {
                    log.warn("Session for {} cannot be unsealed, skipped: {}", peer, e.getMessage());
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list sessions", e);
        }
        return out;
    }

    @Override
    public synchronized void deleteSession(PeerKey peer) {
        deleteByKey("sessions", peer);
    }

    // ---------- Contacts ----------
    @Override
    public synchronized boolean insertContactIfAbsent(ContactRecord c) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO contacts(peer_key,display_name,trust_origin,established_at) VALUES(?,?,?,?) " +
                        "ON CONFLICT(peer_key) DO NOTHING")) {
            ps.setString(1, c.publicKey().urlSafe());
            ps.setString(2, c.displayName());
            ps.setString(3, c.trustOrigin().name());
            ps.setLong(4, c.establishedAt());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Cannot save contact " + c.publicKey(), e);
        }
    }

    @Override
    public synchronized List<ContactRecord> listContacts() {
        List<ContactRecord> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT peer_key,display_name,trust_origin,established_at FROM contacts ORDER BY established_at");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ContactRecord(
                        PeerKey.fromUrlSafe(rs.getString(1)),
                        rs.getString(2),
                        TrustOrigin.valueOf(rs.getString(3)),
                        rs.getLong(4)));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list contacts", e);
        }
        return out;
    }

    @Override
    public synchronized void deleteContact(PeerKey peer) {
        deleteByKey("contacts", peer);
    }

    // ---------- Prekeys ----------
    @Override
    public synchronized void saveSignedPrekey(SignedPrekey p) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO signed_prekeys(id,public_key,private_key,signature,created_at) VALUES(?,?,?,?,?)")) {
            ps.setInt(1, p.id());
            ps.setBytes(2, p.publicKey());
            ps.setBytes(3, secrets.seal(p.privateKey()));
            ps.setBytes(4, p.signature());
            ps.setLong(5, p.timestamp());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot save signed prekey " + p.id(), e);
        }
    }

    @Override
    public synchronized List<SignedPrekey> listSignedPrekeys() {
        List<SignedPrekey> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id,public_key,private_key,signature,created_at FROM signed_prekeys ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SignedPrekey(rs.getInt(1), rs.getBytes(2), secrets.open(rs.getBytes(3)),
                        rs.getBytes(4), rs.getLong(5)));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list signed prekeys", e);
        }
        return out;
    }

    @Override
    public synchronized void deleteSignedPrekey(int id) {
        deleteById("signed_prekeys", id);
    }

    @Override
    public synchronized void saveOneTimePrekeys(List<OneTimePrekey> prekeys) {
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO one_time_prekeys(id,public_key,private_key,reserved) VALUES(?,?,?,0)")) {
                for (OneTimePrekey p : prekeys) {
                    ps.setInt(1, p.id());
                    ps.setBytes(2, p.publicKey());
                    ps.setBytes(3, secrets.seal(p.privateKey()));
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot save one-time prekeys", e);
        }
    }

    @Override
    public synchronized List<OneTimePrekey> listOneTimePrekeys() {
        return queryOneTimePrekeys("SELECT id,public_key,private_key FROM one_time_prekeys ORDER BY id");
    }

    @Override
    public synchronized List<OneTimePrekey> listUnreservedOneTimePrekeys() {
        return queryOneTimePrekeys(
                "SELECT id,public_key,private_key FROM one_time_prekeys WHERE reserved=0 ORDER BY id");
    }

    @Override
    public synchronized void reserveOneTimePrekey(int id) {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE one_time_prekeys SET reserved=1 WHERE id=?")) {
            ps.setInt(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot reserve one-time prekey " + id, e);
        }
    }

    private List<OneTimePrekey> queryOneTimePrekeys(String sql) {
        List<OneTimePrekey> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new OneTimePrekey(rs.getInt(1), rs.getBytes(2), secrets.open(rs.getBytes(3))));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot list one-time prekeys", e);
        }
        return out;
    }

    @Override
    public synchronized void deleteOneTimePrekey(int id) {
        deleteById("one_time_prekeys", id);
    }

    // ---------- Maintenance ----------
    @Override
    public synchronized void clear() {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM sessions");
            st.executeUpdate("DELETE FROM contacts");
            st.executeUpdate("DELETE FROM signed_prekeys");
            st.executeUpdate("DELETE FROM one_time_prekeys");
        } catch (SQLException e) {
            throw new StoreException("Cannot clear database", e);
        }
    }

    @Override
    public synchronized void flush() {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(FULL)");
        } catch (SQLException e) {
            throw new StoreException("WAL checkpoint failed", e);
        }
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        try {
            if (!conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Closing database failed: {}", e.getMessage());
        }
    }

    private void deleteByKey(String table, PeerKey peer) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE peer_key=?")) {
            ps.setString(1, peer.urlSafe());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot delete from " + table, e);
        }
    }

    private void deleteById(String table, int id) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM " + table + " WHERE id=?")) {
            ps.setInt(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot delete from " + table, e);
        }
    }
}
