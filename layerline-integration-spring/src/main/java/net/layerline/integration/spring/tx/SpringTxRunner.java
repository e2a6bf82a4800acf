package net.layerline.integration.spring.tx;

import net.layerline.adapter.jdbc.TxContext;
import net.layerline.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** Spring 트랜잭션 안에서 물리 커넥션을 TxContext 에 꽂아 JDBC 리포지토리가 쓰게 한다 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // REQUIRED 로 참여하면 같은 커넥션, REQUIRES_NEW 면 새 커넥션이 나온다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedFailure(e);
                } finally {
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedFailure f) {
            // 롤백은 끝났고 원래 예외를 그대로 올린다
            throw f.checked;
        } finally {
            if (outer != null) TxContext.set(outer);
            else TxContext.clear();
        }
    }

    private static final class CheckedFailure extends RuntimeException {
        final Exception checked;

        CheckedFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
