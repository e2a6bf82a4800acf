package net.layerline.core.spi;

import net.layerline.core.model.JobType;

/**
 * 외부 처리기 계약. 두 가지 호출 형태만 존재한다.
 * {@link SyncProcessor} (요청/응답) 와 {@link PolledProcessor} (제출 후 id 로 폴링).
 */
public sealed interface RemoteProcessor permits SyncProcessor, PolledProcessor {
    JobType type();
}
