package com.scholary.pdf.handler.worker;

/**
 * Point-in-time view of the worker pool.
 *
 * <p>{@code orphaned} counts abandoned worker threads that are still running a job which ignored
 * interruption.
 */
public record WorkerPoolStatus(
    int workers,
    int busy,
    long completed,
    long failed,
    long timedOut,
    long replaced,
    int orphaned) {}
