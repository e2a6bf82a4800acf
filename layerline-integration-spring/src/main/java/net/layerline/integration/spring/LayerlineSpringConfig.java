package net.layerline.integration.spring;

import net.layerline.adapter.jdbc.repo.JdbcCacheIndexRepository;
import net.layerline.adapter.jdbc.repo.JdbcJobRepository;
import net.layerline.core.spi.CacheIndexRepository;
import net.layerline.core.spi.Clock;
import net.layerline.core.spi.JobRepository;
import net.layerline.core.spi.TxRunner;
import net.layerline.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Configuration
public class LayerlineSpringConfig {

    // TxRunner (Spring). 트랜잭션 매니저가 등록되지 않은 컨텍스트면 같은 DataSource 로 직접 만든다
    @Bean
    @ConditionalOnMissingBean
    public TxRunner txRunner(ObjectProvider<PlatformTransactionManager> tm, DataSource ds) {
        return new SpringTxRunner(tm.getIfAvailable(() -> new DataSourceTransactionManager(ds)), ds);
    }

    // 리포지토리 (adapter-jdbc 재사용)
    @Bean @ConditionalOnMissingBean
    public JobRepository jobRepository() { return new JdbcJobRepository(); }

    @Bean @ConditionalOnMissingBean
    public CacheIndexRepository cacheIndexRepository() { return new JdbcCacheIndexRepository(); }

    // PostgreSQL timestamp 정밀도(마이크로초)에 맞춘다. 안 맞추면 낙관적 비교/커서가 어긋난다
    @Bean @ConditionalOnMissingBean
    public Clock layerlineClock() { return () -> Instant.now().truncatedTo(ChronoUnit.MICROS); }
}
