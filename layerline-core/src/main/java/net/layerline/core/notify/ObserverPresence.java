package net.layerline.core.notify;

import net.layerline.core.model.Job;

/** 지금 이 Job 을 화면에서 보고 있는 관찰자가 있는지 */
@FunctionalInterface
public interface ObserverPresence {
    boolean hasObservers(Job job);

    ObserverPresence NOBODY = job -> false;
}
