package net.layerline.core.spi;

/** 호출 자체가 최종 결과 또는 확정 오류를 돌려주는 처리기 */
public non-sealed interface SyncProcessor extends RemoteProcessor {
    ProcessorResult process(ProcessorRequest request) throws Exception;
}
