package com.hartwig.hpcwe;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ThreadUtil {
    private ThreadUtil() {
    }

    /**
     * Bounded pool whose idle threads time out. Work beyond {@code nThreads} queues instead of being rejected.
     */
    public static ExecutorService createExecutorService(int nThreads, String nameTemplate) {
        var executor = new ThreadPoolExecutor(nThreads,
                nThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
