package net.layerline.core.notify;

import net.layerline.core.model.Job;
import net.layerline.core.model.ResourceKey;
import net.layerline.core.spi.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Job Store 변경을 0..N 개의 관찰자에게 fan-out 한다.
 * <ul>
 *   <li>구독 대상은 Job id 또는 resourceKey 값</li>
 *   <li>첫 구독 시 현재 상태를 즉시 전달</li>
 *   <li>구독별로 version 이 줄어드는 상태는 버린다 (중간 상태는 건너뛸 수 있음)</li>
 * </ul>
 * Executor 와 수명이 독립적이며 관찰자가 0 이어도 Job 은 계속 진행된다.
 */
public final class ChangeNotifier implements JobChangeListener, ObserverPresence {
    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final JobRepository jobs;
    private final Executor delivery;
    private final Map<String, List<Registration>> byTarget = new ConcurrentHashMap<>();

    /**
     * @param jobs     첫 구독 시 현재 상태 조회용
     * @param delivery 콜백 실행기. 호출 스레드에서 바로 실행하려면 {@code Runnable::run}
     */
    public ChangeNotifier(JobRepository jobs, Executor delivery) {
        this.jobs = jobs;
        this.delivery = delivery;
    }

    /** Job id 로 구독 */
    public Subscription subscribe(String jobId, JobObserver observer) throws Exception {
        return register(Target.job(jobId), observer, () -> jobs.findById(jobId));
    }

    /** resourceKey 로 구독. 현재 진행 중인 Job 이 있으면 즉시 전달 */
    public Subscription subscribeResource(ResourceKey key, JobObserver observer) throws Exception {
        return register(Target.resource(key.value()), observer, () -> jobs.findActiveByResourceKey(key));
    }

    private Subscription register(String target, JobObserver observer,
                                  Callable<Optional<Job>> current) throws Exception {
        Objects.requireNonNull(observer, "observer");
        var reg = new Registration(observer);
        // 등록 후에 현재 상태를 읽어야 그 사이의 변경을 놓치지 않는다.
        // add 는 remove 의 빈 목록 정리와 같은 원자 구간 안에서 해야 한다
        byTarget.compute(target, (k, list) -> {
            List<Registration> l = list == null ? new CopyOnWriteArrayList<>() : list;
            l.add(reg);
            return l;
        });
        Subscription sub = () -> remove(target, reg);
        try {
            current.call().ifPresent(job -> dispatch(reg, job));
        } catch (Exception e) {
            sub.unsubscribe();
            throw e;
        }
        return sub;
    }

    private void remove(String target, Registration reg) {
        reg.active = false;
        byTarget.computeIfPresent(target, (k, list) -> {
            list.remove(reg);
            return list.isEmpty() ? null : list;
        });
    }

    @Override
    public void onChange(Job job) {
        fanOut(Target.job(job.id()), job);
        fanOut(Target.resource(job.resourceKey().value()), job);
    }

    /** 해당 Job 을 지금 보고 있는 관찰자가 있는가 (push 알림 여부 판단) */
    @Override
    public boolean hasObservers(Job job) {
        return !byTarget.getOrDefault(Target.job(job.id()), List.of()).isEmpty()
                || !byTarget.getOrDefault(Target.resource(job.resourceKey().value()), List.of()).isEmpty();
    }

    public int observerCount() {
        return byTarget.values().stream().mapToInt(List::size).sum();
    }

    private void fanOut(String target, Job job) {
        var list = byTarget.get(target);
        if (list == null) return;
        for (Registration reg : list) dispatch(reg, job);
    }

    private void dispatch(Registration reg, Job job) {
        delivery.execute(() -> reg.deliver(job));
    }

    private static final class Registration {
        private final JobObserver observer;
        private volatile boolean active = true;
        private long lastVersion = -1;
        private String lastJobId;

        Registration(JobObserver observer) { this.observer = observer; }

        synchronized void deliver(Job job) {
            if (!active) return;
            // 같은 Job 에 대해 version 역행 금지. 동일 version 재전달은 허용(at-least-once)
            if (job.id().equals(lastJobId) && job.version() < lastVersion) return;
            lastJobId = job.id();
            lastVersion = job.version();
            try {
                observer.onJob(job);
            } catch (RuntimeException e) {
                log.warn("observer failed for job={}", job.id(), e);
            }
        }
    }

    private static final class Target {
        static String job(String id) { return "job:" + id; }
        static String resource(String key) { return "res:" + key; }
    }
}
