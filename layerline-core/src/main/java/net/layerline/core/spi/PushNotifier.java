package net.layerline.core.spi;

import net.layerline.core.model.PushMessage;

@FunctionalInterface
public interface PushNotifier {
    void send(PushMessage message) throws Exception;
}
