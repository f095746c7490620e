package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "formula" prefix in application.yml.
 */
@ConfigurationProperties(prefix = "formula")
public class EngineProperties {

    private Grid grid = new Grid();
    private Worker worker = new Worker();

    public Grid getGrid() {
        return grid;
    }

    public void setGrid(Grid grid) {
        this.grid = grid;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public static class Grid {
        private int maxColumns = 26;
        private int maxRows = 100;

        public int getMaxColumns() {
            return maxColumns;
        }

        public void setMaxColumns(int maxColumns) {
            this.maxColumns = maxColumns;
        }

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }
    }

    public static class Worker {
        // how long a REST call waits for its request to be processed
        private long requestTimeoutMs = 10000;

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }
}
