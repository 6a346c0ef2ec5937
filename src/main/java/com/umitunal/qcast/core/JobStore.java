package com.umitunal.qcast.core;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Persistent store of recurring broadcast jobs.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Jobs that are active and whose next run is at or before {@code now},
     * ordered by next run time.
     */
    List<BroadcastJob> listDueActiveJobs(Instant now) throws Exception;

    /**
     * Fetch the current state of a job.
     *
     * @return the job, or null if it does not exist
     */
    BroadcastJob getJob(String jobId) throws Exception;

    /**
     * Atomically apply a schedule change to a job.
     *
     * @return false if the job no longer exists
     */
    boolean updateJobSchedule(String jobId, ScheduleUpdate update) throws Exception;

    /**
     * Atomically read, modify and write a job. The change must keep the id.
     *
     * @return the stored result, or null if the job does not exist
     */
    BroadcastJob updateJob(String jobId, UnaryOperator<BroadcastJob> change) throws Exception;

    /**
     * Create or replace a job.
     */
    void saveJob(BroadcastJob job) throws Exception;

    /**
     * Remove a job.
     *
     * @return false if the job did not exist
     */
    boolean deleteJob(String jobId) throws Exception;

    /**
     * All jobs, active or not.
     */
    List<BroadcastJob> listJobs() throws Exception;
}
