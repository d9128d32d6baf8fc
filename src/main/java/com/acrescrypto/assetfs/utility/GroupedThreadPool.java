package com.acrescrypto.assetfs.utility;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fixed-size executor whose daemon threads share a named ThreadGroup, so archive jobs are easy to pick out of a
 * thread dump. Threads are renamed while they run a task. */
public class GroupedThreadPool {
	private final static Logger logger = LoggerFactory.getLogger(GroupedThreadPool.class);

	protected final ThreadGroup threadGroup;
	protected final ExecutorService executor;
	protected final AtomicInteger threadCount = new AtomicInteger();
	protected final String name;

	public static GroupedThreadPool newFixedThreadPool(String name, int threads) {
		return new GroupedThreadPool(Thread.currentThread().getThreadGroup(), name, threads);
	}

	public GroupedThreadPool(ThreadGroup parent, String name, int threads) {
		if(threads < 1) throw new IllegalArgumentException(name + ": need at least one thread, got " + threads);

		this.name = name;
		this.threadGroup = new ThreadGroup(parent, name);
		this.executor = Executors.newFixedThreadPool(threads, (task)->{
			int id = threadCount.incrementAndGet();
			Thread thread = new Thread(threadGroup, ()->{
				Util.setThreadName(name + " #" + id + " idle");
				task.run();
			});

			thread.setDaemon(true);
			return thread;
		});

		logger.debug("GroupedThreadPool {}: started with {} threads", name, threads);
	}

	public ThreadGroup getThreadGroup() {
		return threadGroup;
	}

	public Future<?> submit(Runnable task) {
		return executor.submit(()->runNamed(()->{
			task.run();
			return null;
		}));
	}

	public <T> Future<T> submit(Callable<T> task) {
		return executor.submit(()->runNamed(task));
	}

	public void shutdownNow() {
		logger.debug("GroupedThreadPool {}: shutting down", name);
		executor.shutdownNow();
	}

	public boolean awaitTermination(long timeoutMs) throws InterruptedException {
		return executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
	}

	public boolean isShutdown() {
		return executor.isShutdown();
	}

	protected <T> T runNamed(Callable<T> task) throws Exception {
		String idleName = Thread.currentThread().getName();
		Thread.currentThread().setName(idleName.replace(" idle", " active"));
		try {
			return task.call();
		} finally {
			Thread.currentThread().setName(idleName);
		}
	}
}
