package net.layerline.adapter.jdbc;

import net.layerline.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 바깥 트랜잭션에 참여
            return body.call();
        }
        return inNewConnection(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        Connection suspended = TxContext.get();
        try {
            return inNewConnection(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewConnection(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {
                rollback(c, t);
                throw t;
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prev) {
        try {
            c.setAutoCommit(prev);
        } catch (SQLException e) {
            log.debug("could not restore autoCommit on pooled connection", e);
        }
    }
}
