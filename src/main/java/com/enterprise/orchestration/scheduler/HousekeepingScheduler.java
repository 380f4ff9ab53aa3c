package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.bus.MessageBus;
import it.sauronsoftware.cron4j.Scheduler;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cron-driven retention jobs: purges settled workflows, old message history and
 * expired dead letters.
 */
public class HousekeepingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HousekeepingScheduler.class);

    public static final String DEFAULT_PATTERN = "* * * * *";
    public static final String RETENTION_JOB = "retention";

    private final TaskGraphScheduler taskScheduler;
    private final MessageBus bus;
    private final String retentionPattern;
    private final Scheduler cronScheduler;
    private final Map<String, ScheduledJob> scheduledJobs = new ConcurrentHashMap<>();

    public HousekeepingScheduler(TaskGraphScheduler taskScheduler, MessageBus bus, String retentionPattern) {
        this.taskScheduler = taskScheduler;
        this.bus = bus;
        this.retentionPattern = retentionPattern != null ? retentionPattern : DEFAULT_PATTERN;
        if (!SchedulingPattern.validate(this.retentionPattern)) {
            throw new IllegalArgumentException("Invalid cron expression: " + this.retentionPattern);
        }
        this.cronScheduler = new Scheduler();
    }

    /**
     * Registers an additional job
     *
     * @return the job name
     */
    public String schedule(String jobName, String cronExpression, Runnable action) {
        if (!SchedulingPattern.validate(cronExpression)) {
            logger.error("Invalid cron expression for job {}: {}", jobName, cronExpression);
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
        ScheduledJob job = new ScheduledJob(jobName, cronExpression);
        String schedulerId = cronScheduler.schedule(cronExpression, () -> {
            try {
                action.run();
                job.recordRun(Instant.now());
                logger.debug("Housekeeping job {} finished", jobName);
            } catch (Exception e) {
                logger.error("Error running housekeeping job {}", jobName, e);
            }
        });
        job.schedulerId = schedulerId;
        ScheduledJob previous = scheduledJobs.put(jobName, job);
        if (previous != null) {
            cronScheduler.deschedule(previous.schedulerId);
        }
        logger.info("Scheduled housekeeping job {} with expression: {}", jobName, cronExpression);
        return jobName;
    }

    public boolean cancelJob(String jobName) {
        ScheduledJob job = scheduledJobs.remove(jobName);
        if (job == null) {
            return false;
        }
        cronScheduler.deschedule(job.schedulerId);
        logger.info("Cancelled housekeeping job: {}", jobName);
        return true;
    }

    /**
     * Runs the retention pass immediately on the calling thread
     */
    public RetentionResult runNow() {
        int tasks = taskScheduler.purgeExpired();
        int messages = bus.cleanupHistory();
        int deadLetters = bus.purgeDeadLetters();
        RetentionResult result = new RetentionResult(tasks, messages, deadLetters);
        if (result.getTotal() > 0) {
            logger.info("Retention pass removed {}", result);
        }
        return result;
    }

    public void start() {
        if (cronScheduler.isStarted()) {
            return;
        }
        schedule(RETENTION_JOB, retentionPattern, this::runNow);
        cronScheduler.start();
        logger.info("HousekeepingScheduler started");
    }

    public void stop() {
        if (!cronScheduler.isStarted()) {
            return;
        }
        cronScheduler.stop();
        for (ScheduledJob job : scheduledJobs.values()) {
            cronScheduler.deschedule(job.schedulerId);
        }
        scheduledJobs.clear();
        logger.info("HousekeepingScheduler stopped");
    }

    public boolean isRunning() {
        return cronScheduler.isStarted();
    }

    public Map<String, ScheduledJob> getScheduledJobs() {
        return Map.copyOf(scheduledJobs);
    }

    boolean isRegisteredWithCron(ScheduledJob job) {
        return cronScheduler.getTask(job.schedulerId) != null;
    }

    /**
     * Counts removed by one retention pass
     */
    public static class RetentionResult {
        private final int tasksPurged;
        private final int messagesRemoved;
        private final int deadLettersRemoved;

        public RetentionResult(int tasksPurged, int messagesRemoved, int deadLettersRemoved) {
            this.tasksPurged = tasksPurged;
            this.messagesRemoved = messagesRemoved;
            this.deadLettersRemoved = deadLettersRemoved;
        }

        public int getTasksPurged() { return tasksPurged; }
        public int getMessagesRemoved() { return messagesRemoved; }
        public int getDeadLettersRemoved() { return deadLettersRemoved; }

        public int getTotal() {
            return tasksPurged + messagesRemoved + deadLettersRemoved;
        }

        @Override
        public String toString() {
            return tasksPurged + " tasks, " + messagesRemoved + " messages, " + deadLettersRemoved + " dead letters";
        }
    }

    /**
     * A registered cron job
     */
    public static class ScheduledJob {
        private final String jobName;
        private final String cronExpression;
        private final Instant createdAt;
        private final AtomicLong runs = new AtomicLong();
        private volatile Instant lastRun;
        private volatile String schedulerId;

        ScheduledJob(String jobName, String cronExpression) {
            this.jobName = jobName;
            this.cronExpression = cronExpression;
            this.createdAt = Instant.now();
        }

        void recordRun(Instant at) {
            runs.incrementAndGet();
            lastRun = at;
        }

        public String getJobName() { return jobName; }
        public String getCronExpression() { return cronExpression; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getLastRun() { return lastRun; }
        public long getRuns() { return runs.get(); }
    }
}
