package net.layerline.core.notify;

import net.layerline.core.model.PushMessage;
import net.layerline.core.spi.PushNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 전달 채널이 설정되지 않았을 때의 기본값 */
public final class LoggingPushNotifier implements PushNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingPushNotifier.class);

    @Override
    public void send(PushMessage message) {
        log.info("push job={} status={}: {}", message.jobId(), message.status().code(), message.summary());
    }
}
