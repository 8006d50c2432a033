package com.eventtally.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "eventtally")
public class EventTallyProperties {
    private Ingest ingest = new Ingest();
    private Storage storage = new Storage();
    private Query query = new Query();

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public static class Ingest {
        /** Distinct (customer, minute) keys buffered before a flush. */
        private int batchSize = 1000;

        private int busyRetries = 5;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getBusyRetries() {
            return busyRetries;
        }

        public void setBusyRetries(int busyRetries) {
            this.busyRetries = busyRetries;
        }
    }

    public static class Storage {
        private boolean resetOnStartup = true;

        public boolean isResetOnStartup() {
            return resetOnStartup;
        }

        public void setResetOnStartup(boolean resetOnStartup) {
            this.resetOnStartup = resetOnStartup;
        }
    }

    public static class Query {
        /** Largest number of buckets one range query may return. */
        private int maxBuckets = 100_000;

        public int getMaxBuckets() {
            return maxBuckets;
        }

        public void setMaxBuckets(int maxBuckets) {
            this.maxBuckets = maxBuckets;
        }
    }
}
