package com.salesops.crmsync.scheduling;

/**
 * Registers recurring jobs by name. Scheduling a name that is already registered replaces it.
 */
public interface JobScheduler {

    void schedule(String name, String cron, Runnable job);

    boolean cancel(String name);
}
