package net.layerline.core.notify;

import net.layerline.core.model.Job;

/** Job Store 가 커밋한 변경(전이/진행률)을 받는다 */
@FunctionalInterface
public interface JobChangeListener {
    void onChange(Job job);

    JobChangeListener NONE = job -> {};
}
