package net.layerline.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. required 는 바깥 트랜잭션에 참여하고,
 * requiresNew 는 바깥을 잠시 내려놓고 새 트랜잭션을 연다.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    <T> T requiresNew(Callable<T> body) throws Exception;

    @FunctionalInterface
    interface Work {
        void run() throws Exception;
    }

    /** 반환값 없는 required */
    default void inTx(Work work) throws Exception {
        required(() -> {
            work.run();
            return null;
        });
    }
}
