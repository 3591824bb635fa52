package org.holography.panels.common;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

public class MultiThreading {
	public static int THREADS_MAX = 100;

	public static Thread[] newThreadArray() {
		return newThreadArray (THREADS_MAX);
	}

	/**
	 * Allocate a worker array no larger than the number of available processors
	 * @param maxCPUs upper limit on the number of workers
	 * @return empty thread array to be populated by the caller
	 */
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus > maxCPUs) n_cpus = maxCPUs;
		if (n_cpus < 1) n_cpus = 1;
		return new Thread[n_cpus];
	}

	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	/**
	 * Run task for every index in [0, num_items) on a shared worker array. Items
	 * are handed out through a common counter, so each index is processed once.
	 * The first exception thrown by a worker is rethrown on the calling thread.
	 * @param num_items number of items
	 * @param threads_max maximal number of workers
	 * @param task consumer of the item index
	 */
	public static void forEachIndex(
			final int         num_items,
			final int         threads_max,
			final IntConsumer task) {
		if (num_items <= 0) {
			return;
		}
		final Thread[] threads = newThreadArray(Math.min(threads_max, num_items));
		final AtomicInteger ai = new AtomicInteger(0);
		final RuntimeException [] failure = new RuntimeException[1];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				@Override
				public void run() {
					for (int indx = ai.getAndIncrement(); indx < num_items; indx = ai.getAndIncrement()) {
						try {
							task.accept(indx);
						} catch (RuntimeException e) {
							synchronized (failure) {
								if (failure[0] == null) failure[0] = e;
							}
						}
					}
				}
			};
		}
		startAndJoin(threads);
		if (failure[0] != null) {
			throw failure[0];
		}
	}
}
