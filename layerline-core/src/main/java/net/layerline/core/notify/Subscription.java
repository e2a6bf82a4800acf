package net.layerline.core.notify;

/** 구독 해제 핸들. 해제해도 Job 실행에는 영향이 없다 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    void unsubscribe();

    @Override
    default void close() { unsubscribe(); }
}
