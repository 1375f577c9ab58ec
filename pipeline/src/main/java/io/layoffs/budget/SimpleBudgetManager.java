package io.layoffs.budget;

import java.util.concurrent.Semaphore;

/**
 * Semaphore-backed CPU budget.
 */
public class SimpleBudgetManager implements Budget {
    private final Semaphore cpu;

    public SimpleBudgetManager(int cpuThreads) {
        this.cpu = new Semaphore(Math.max(1, cpuThreads));
    }

    @Override
    public boolean tryAcquireCpu() {
        return cpu.tryAcquire();
    }

    @Override
    public void releaseCpu() {
        cpu.release();
    }

    @Override
    public int availableCpu() {
        return cpu.availablePermits();
    }
}
