package net.layerline.core.notify;

import net.layerline.core.model.Job;

/** 같은 상태를 두 번 받아도 안전해야 한다 */
@FunctionalInterface
public interface JobObserver {
    void onJob(Job job);
}
