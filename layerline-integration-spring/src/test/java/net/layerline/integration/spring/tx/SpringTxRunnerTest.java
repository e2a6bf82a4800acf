package net.layerline.integration.spring.tx;

import net.layerline.adapter.jdbc.TxContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpringTxRunnerTest {
    DriverManagerDataSource ds;
    JdbcTemplate jdbc;
    SpringTxRunner tx;

    @BeforeEach
    void setUp() {
        ds = new DriverManagerDataSource("jdbc:h2:mem:spring_tx;DB_CLOSE_DELAY=-1", "sa", "");
        jdbc = new JdbcTemplate(ds);
        jdbc.execute("CREATE TABLE IF NOT EXISTS T_ITEM (NAME VARCHAR(50))");
        jdbc.execute("DELETE FROM T_ITEM");
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    private static void insert(String name) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("INSERT INTO T_ITEM (NAME) VALUES (?)")) {
            ps.setString(1, name);
            ps.executeUpdate();
        }
    }

    private int count() {
        return jdbc.queryForObject("SELECT COUNT(*) FROM T_ITEM", Integer.class);
    }

    @Test
    void commitsAndClearsContext() throws Exception {
        tx.inTx(() -> insert("a"));

        assertThat(count()).isEqualTo(1);
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void checkedException_rollsBackAndPropagatesUnwrapped() {
        assertThatThrownBy(() -> tx.required(() -> {
            insert("b");
            throw new IOException("provider down");
        })).isInstanceOf(IOException.class).hasMessage("provider down");

        assertThat(count()).isZero();
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void nestedRequired_sharesConnection() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.get();
            Connection inner = tx.required(TxContext::get);
            assertThat(inner).isSameAs(outer);
            assertThat(TxContext.get()).isSameAs(outer);
            return null;
        });
    }

    @Test
    void requiresNew_commitsIndependentlyOfOuterRollback() {
        assertThatThrownBy(() -> tx.required(() -> {
            insert("outer");
            tx.requiresNew(() -> { insert("inner"); return null; });
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(jdbc.queryForList("SELECT NAME FROM T_ITEM", String.class)).containsExactly("inner");
    }
}
