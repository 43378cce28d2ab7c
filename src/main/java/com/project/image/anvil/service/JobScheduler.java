package com.project.image.anvil.service;

import com.project.image.anvil.DTOs.CancelOutcome;
import com.project.image.anvil.DTOs.JobKind;
import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.JobSnapshot;
import com.project.image.anvil.DTOs.JobStatus;
import com.project.image.anvil.DTOs.ProcessingResult;
import com.project.image.anvil.DTOs.SchedulerStats;
import com.project.image.anvil.config.AnvilProperties;
import com.project.image.anvil.exceptions.AnvilException;
import com.project.image.anvil.exceptions.QueueOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, memory-first job scheduler.
 *
 * <p>Jobs wait in a FIFO queue and are executed by a small fixed pool of worker threads
 * (one by default). Each running job may hold several full-size rasters, so the pool is
 * capped at {@link #MAX_POOL_SIZE} and the queue at {@code maxQueueDepth}; a full queue
 * rejects new work instead of growing.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * String id = scheduler.submit(JobRequest.preview(image, spec, "beach"));
 * scheduler.status(id);   // poll until DONE or ERROR
 * scheduler.collect(id);  // take the result and free the slot
 * scheduler.stop();
 * }</pre>
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public static final int MAX_POOL_SIZE = 4;

    private final AnvilProperties.Scheduler props;
    private final JobProcessor processor;
    private final Clock clock;

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final ArrayDeque<Job> queue = new ArrayDeque<>();
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition jobAvailable = queueLock.newCondition();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<Thread> workers = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService cleaner;

    private static final class Job {
        private final String id;
        private final JobRequest request;
        private final Instant createdAt;
        private volatile JobStatus status = JobStatus.QUEUED;
        private volatile ProcessingResult result;
        private volatile String errorDetail;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile boolean discard;

        private Job(String id, JobRequest request, Instant createdAt) {
            this.id = id;
            this.request = request;
            this.createdAt = createdAt;
        }

        private JobKind kind() {
            return request.kind();
        }
    }

    public JobScheduler(AnvilProperties.Scheduler props, JobProcessor processor) {
        this(props, processor, Clock.systemUTC());
    }

    public JobScheduler(AnvilProperties.Scheduler props, JobProcessor processor, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the workers and the cleanup task. Idempotent.
     */
    public void start() {
        int poolSize = props.getPoolSize();
        if (poolSize < 1 || poolSize > MAX_POOL_SIZE) {
            throw new IllegalArgumentException("app.anvil.scheduler.pool-size must be between 1 and "
                    + MAX_POOL_SIZE + ", got " + poolSize);
        }
        if (props.getMaxQueueDepth() < 1) {
            throw new IllegalArgumentException("app.anvil.scheduler.max-queue-depth must be positive");
        }
        Duration cleanupInterval = Objects.requireNonNull(props.getCleanupInterval(), "cleanupInterval must not be null");
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("app.anvil.scheduler.cleanup-interval must be a positive duration");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Job scheduler starting with poolSize={}, maxQueueDepth={}, resultTtl={}",
                poolSize, props.getMaxQueueDepth(), props.getResultTtl());

        for (int i = 0; i < poolSize; i++) {
            Thread worker = new Thread(this::workerLoop);
            worker.setName("anvil.worker-" + i);
            worker.setDaemon(true);
            worker.start();
            workers.add(worker);
        }

        cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("anvil.job-cleanup");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = cleanupInterval.toMillis();
        cleaner.scheduleWithFixedDelay(this::cleanupQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Job scheduler started.");
    }

    /**
     * Stop the workers. A running job is interrupted; queued jobs stay queued. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Job scheduler stopping...");
        queueLock.lock();
        try {
            jobAvailable.signalAll();
        } finally {
            queueLock.unlock();
        }
        for (Thread worker : workers) {
            worker.interrupt();
        }
        for (Thread worker : workers) {
            try {
                worker.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.clear();
        if (cleaner != null) {
            cleaner.shutdownNow();
            cleaner = null;
        }
        log.info("Job scheduler stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Admit a job and return its id immediately.
     *
     * @throws QueueOverflowException when {@code maxQueueDepth} jobs are already waiting
     */
    public String submit(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        processor.admit(request);

        Job job = new Job(UUID.randomUUID().toString().replace("-", ""), request, clock.instant());
        int position;
        queueLock.lock();
        try {
            if (queue.size() >= props.getMaxQueueDepth()) {
                log.warn("Rejected {} job: queue full ({} waiting)", request.kind(), queue.size());
                throw new QueueOverflowException(props.getMaxQueueDepth());
            }
            jobs.put(job.id, job);
            queue.addLast(job);
            position = queue.size();
            jobAvailable.signal();
        } finally {
            queueLock.unlock();
        }
        log.info("Submitted {} job {} at queue position {}", request.kind(), job.id, position);
        return job.id;
    }

    public Optional<JobSnapshot> status(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(snapshot(job));
    }

    /**
     * Status of a job, evicting it when it has finished. Use once the caller has
     * taken the result.
     */
    public Optional<JobSnapshot> collect(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        JobSnapshot snapshot = snapshot(job);
        if (snapshot.status().isTerminal()) {
            jobs.remove(jobId, job);
            log.debug("Collected job {}", jobId);
        }
        return Optional.of(snapshot);
    }

    /**
     * A queued job is removed outright. A running job cannot be stopped mid-composite:
     * it is flagged and its result dropped when the worker finishes.
     */
    public CancelOutcome cancel(String jobId) {
        queueLock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                return CancelOutcome.NOT_FOUND;
            }
            switch (job.status) {
                case QUEUED -> {
                    queue.remove(job);
                    jobs.remove(jobId);
                    log.info("Cancelled queued job {}", jobId);
                    return CancelOutcome.REMOVED;
                }
                case RUNNING -> {
                    job.discard = true;
                    log.info("Job {} is running; result will be discarded", jobId);
                    return CancelOutcome.DISCARD_PENDING;
                }
                default -> {
                    return CancelOutcome.ALREADY_FINISHED;
                }
            }
        } finally {
            queueLock.unlock();
        }
    }

    public SchedulerStats stats() {
        int queued = 0, running = 0, done = 0, failed = 0;
        List<SchedulerStats.PendingJob> pending = new ArrayList<>();
        for (Job job : jobs.values()) {
            JobStatus status = job.status;
            switch (status) {
                case QUEUED -> queued++;
                case RUNNING -> running++;
                case DONE -> done++;
                case ERROR -> failed++;
            }
            if (!status.isTerminal()) {
                pending.add(new SchedulerStats.PendingJob(job.id, job.kind(), status, job.createdAt));
            }
        }
        pending.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return new SchedulerStats(workers.size(), props.getMaxQueueDepth(), queued, running, done, failed, pending);
    }

    /**
     * Drop finished jobs older than the result TTL.
     *
     * @return number of evicted jobs
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(props.getResultTtl());
        int evicted = 0;
        Iterator<Job> it = jobs.values().iterator();
        while (it.hasNext()) {
            Job job = it.next();
            Instant completedAt = job.completedAt;
            if (job.status.isTerminal() && completedAt != null && completedAt.isBefore(cutoff)) {
                it.remove();
                evicted++;
                log.info("Cleaned up expired job: {}", job.id);
            }
        }
        return evicted;
    }

    private void workerLoop() {
        String workerName = Thread.currentThread().getName();
        log.info("Worker {} started", workerName);
        while (started.get()) {
            Job job;
            try {
                job = takeNext();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job != null) {
                execute(job, workerName);
            }
        }
        log.info("Worker {} stopped", workerName);
    }

    private Job takeNext() throws InterruptedException {
        queueLock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (!started.get()) {
                    return null;
                }
                jobAvailable.await();
            }
            Job job = queue.pollFirst();
            job.startedAt = clock.instant();
            job.status = JobStatus.RUNNING;
            return job;
        } finally {
            queueLock.unlock();
        }
    }

    private void execute(Job job, String workerName) {
        log.info("Worker {} processing {} job {}", workerName, job.kind(), job.id);
        ProcessingResult result = null;
        String errorDetail = null;
        try {
            result = processor.process(job.request);
        } catch (Exception | OutOfMemoryError e) {
            errorDetail = describe(e);
            log.error("Job {} failed: {}", job.id, errorDetail, e);
        }
        // cancel() reads status and sets discard under the same lock
        queueLock.lock();
        try {
            job.completedAt = clock.instant();
            if (job.discard) {
                jobs.remove(job.id, job);
                log.info("Discarded result of cancelled job {}", job.id);
                return;
            }
            if (errorDetail == null) {
                job.result = result;
                job.status = JobStatus.DONE;
                log.info("Job {} completed in {} ms", job.id,
                        Duration.between(job.startedAt, job.completedAt).toMillis());
            } else {
                job.errorDetail = errorDetail;
                job.status = JobStatus.ERROR;
            }
        } finally {
            queueLock.unlock();
        }
    }

    private void cleanupQuietly() {
        try {
            evictExpired();
        } catch (RuntimeException e) {
            log.error("Job cleanup failed", e);
        }
    }

    private JobSnapshot snapshot(Job job) {
        JobStatus status = job.status;
        Integer position = status == JobStatus.QUEUED ? queuePosition(job) : null;
        return new JobSnapshot(job.id, job.kind(), status, position,
                status == JobStatus.DONE ? job.result : null,
                status == JobStatus.ERROR ? job.errorDetail : null,
                job.createdAt, job.startedAt, job.completedAt);
    }

    /** 1-based position among queued jobs, in admission order. */
    private Integer queuePosition(Job job) {
        queueLock.lock();
        try {
            int position = 1;
            for (Job queued : queue) {
                if (queued == job) {
                    return position;
                }
                position++;
            }
            return null;
        } finally {
            queueLock.unlock();
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof OutOfMemoryError) {
            return "Image processing ran out of memory. Try with a smaller image.";
        }
        if (e instanceof AnvilException) {
            return e.getMessage();
        }
        return "Image processing failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }
}
