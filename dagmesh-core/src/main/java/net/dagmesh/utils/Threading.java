/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.utils;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.util.concurrent.CycleDetectingLockFactory;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Named locks with lock order checking and named worker pools.
 */
public class Threading {

    private static CycleDetectingLockFactory.Policy policy = CycleDetectingLockFactory.Policies.WARN;
    private static CycleDetectingLockFactory factory = CycleDetectingLockFactory.newInstance(policy);

    private Threading() {
    }

    public static ReentrantLock lock(String name) {
        return factory.newReentrantLock(name);
    }

    public static void setPolicy(CycleDetectingLockFactory.Policy newPolicy) {
        policy = newPolicy;
        factory = CycleDetectingLockFactory.newInstance(policy);
    }

    public static CycleDetectingLockFactory.Policy getPolicy() {
        return policy;
    }

    /** Cached pool of daemon threads named {@code <name>-<n>}. */
    public static ExecutorService newWorkerPool(String name) {
        return Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
    }
}
