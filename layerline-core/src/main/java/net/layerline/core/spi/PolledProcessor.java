package net.layerline.core.spi;

import net.layerline.core.poll.PollOptions;
import net.layerline.core.poll.ProgressAdapter;
import net.layerline.core.poll.ProviderStatus;

/** push 채널이 없는 처리기: submit 으로 provider job id 를 받고 getStatus 로 폴링 */
public non-sealed interface PolledProcessor extends RemoteProcessor {
    String submit(ProcessorRequest request) throws Exception;

    ProviderStatus getStatus(String providerJobId) throws Exception;

    /** 이 처리기의 진행률 페이로드를 표준 형태로 바꾸는 어댑터 */
    ProgressAdapter progressAdapter();

    /** 폴링 주기/상한. provider 마다 다르다 */
    default PollOptions pollOptions() { return PollOptions.defaults(); }
}
