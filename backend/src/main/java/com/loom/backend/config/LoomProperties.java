package com.loom.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "loom")
public class LoomProperties {

    private final Events events = new Events();

    public Events getEvents() {
        return events;
    }

    public static class Events {
        /** "sqlite" | "memory" */
        private String store = "sqlite";
        private String dbPath = ".loom/events.db";
        private int defaultLimit = 100;
        private int recentLimit = 50;
        private final Executor executor = new Executor();

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getRecentLimit() {
            return recentLimit;
        }

        public void setRecentLimit(int recentLimit) {
            this.recentLimit = recentLimit;
        }

        public Executor getExecutor() {
            return executor;
        }
    }

    // event log I/O 전용 thread pool
    public static class Executor {
        private int coreSize = 2;
        private int maxSize = 4;
        private int queueCapacity = 500;

        public int getCoreSize() {
            return coreSize;
        }

        public void setCoreSize(int coreSize) {
            this.coreSize = coreSize;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
