package lockerhub.jdbc.tx;

import lockerhub.jdbc.H2Databases;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadLocalTxContextTest {

    private JdbcDataSource dataSource;
    private ThreadLocalTxContext txContext;
    private JdbcTransactionManager txManager;

    @BeforeEach
    void setUp() {
        dataSource = H2Databases.newDataSource();
        txContext = new ThreadLocalTxContext();
        txManager = new JdbcTransactionManager(dataSource::getConnection, txContext);
    }

    private long eventCount() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM events")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void insertEvent(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO events (timestamp, kiosk_id, event_type)"
                    + " VALUES (CURRENT_TIMESTAMP, 'K1', 'kiosk_online')");
        }
    }

    @Test
    void isTransactionActiveReturnsFalseWhenNotBound() {
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void currentConnectionThrowsWhenNotBound() {
        assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
        assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
    }

    @Test
    void beginBindsConnectionUntilCommit() throws SQLException {
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            assertTrue(txContext.isTransactionActive());
            Connection conn = txContext.currentConnection();
            assertFalse(conn.getAutoCommit());
            assertSame(conn, txContext.currentConnection());
            insertEvent(conn);
            tx.commit();
            assertTrue(tx.isCompleted());
        }

        assertFalse(txContext.isTransactionActive());
        assertEquals(1, eventCount());
    }

    @Test
    void closeWithoutCommitRollsBack() throws SQLException {
        List<String> outcomes = new ArrayList<>();

        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            insertEvent(txContext.currentConnection());
            txContext.afterCommit(() -> outcomes.add("commit"));
            txContext.afterRollback(() -> outcomes.add("rollback"));
        }

        assertEquals(List.of("rollback"), outcomes);
        assertEquals(0, eventCount());
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void afterCommitCallbacksRunInOrder() throws SQLException {
        List<Integer> order = new ArrayList<>();

        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            txContext.afterCommit(() -> order.add(1));
            txContext.afterCommit(() -> order.add(2));
            txContext.afterCommit(() -> order.add(3));
            assertTrue(order.isEmpty());
            tx.commit();
        }

        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void failingCallbackDoesNotStopTheOthers() throws SQLException {
        AtomicBoolean laterRan = new AtomicBoolean();

        JdbcTransactionManager.Transaction tx = txManager.begin();
        txContext.afterCommit(() -> {
            throw new IllegalStateException("first");
        });
        txContext.afterCommit(() -> laterRan.set(true));

        IllegalStateException ex = assertThrows(IllegalStateException.class, tx::commit);
        assertEquals("first", ex.getMessage());
        assertTrue(laterRan.get());
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void secondBeginOnSameThreadIsRejected() throws SQLException {
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            assertThrows(IllegalStateException.class, () -> txManager.begin());
            assertTrue(txContext.isTransactionActive());
        }
    }

    @Test
    void transactionIsInvisibleToOtherThreads() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean otherSawTransaction = new AtomicBoolean(true);

        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            Thread other = new Thread(() -> {
                otherSawTransaction.set(txContext.isTransactionActive());
                done.countDown();
            });
            other.start();
            done.await();
            tx.commit();
        }

        assertFalse(otherSawTransaction.get());
    }
}
