package io.procwarden.util;

public interface Ticker {
    Ticker SYSTEM = new Ticker() {
        @Override
        public long nowMs() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long ms) throws InterruptedException {
            if (ms > 0L) {
                Thread.sleep(ms);
            }
        }
    };

    long nowMs();

    void sleep(long ms) throws InterruptedException;
}
