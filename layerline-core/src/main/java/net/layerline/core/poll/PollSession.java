package net.layerline.core.poll;

import net.layerline.core.spi.ProcessorResult;

import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 폴링 핸들. cancel 은 이후 tick 만 멈추며 provider 쪽 작업은 취소하지 않는다.
 */
public interface PollSession {
    CompletableFuture<ProcessorResult> result();

    PollState state();

    void cancel();

    boolean isCancelled();
}
