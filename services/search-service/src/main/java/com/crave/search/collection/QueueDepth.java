package com.crave.search.collection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueDepth {
    @JsonProperty("execution")
    private Stage execution = new Stage();

    @JsonProperty("processing")
    private Stage processing = new Stage();

    public QueueDepth() {
    }

    public QueueDepth(Stage execution, Stage processing) {
        this.execution = execution == null ? new Stage() : execution;
        this.processing = processing == null ? new Stage() : processing;
    }

    public Stage getExecution() {
        return execution;
    }

    public void setExecution(Stage execution) {
        this.execution = execution == null ? new Stage() : execution;
    }

    public Stage getProcessing() {
        return processing;
    }

    public void setProcessing(Stage processing) {
        this.processing = processing == null ? new Stage() : processing;
    }

    @JsonIgnore
    public int getBacklog() {
        return execution.getWaiting() + execution.getActive() + processing.getWaiting() + processing.getActive();
    }

    @Override
    public String toString() {
        return "execution=" + execution + " processing=" + processing;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Stage {
        @JsonProperty("waiting")
        private int waiting;

        @JsonProperty("active")
        private int active;

        @JsonProperty("delayed")
        private int delayed;

        public Stage() {
        }

        public Stage(int waiting, int active, int delayed) {
            this.waiting = waiting;
            this.active = active;
            this.delayed = delayed;
        }

        public int getWaiting() {
            return waiting;
        }

        public void setWaiting(int waiting) {
            this.waiting = waiting;
        }

        public int getActive() {
            return active;
        }

        public void setActive(int active) {
            this.active = active;
        }

        public int getDelayed() {
            return delayed;
        }

        public void setDelayed(int delayed) {
            this.delayed = delayed;
        }

        @Override
        public String toString() {
            return "{waiting=" + waiting + ", active=" + active + ", delayed=" + delayed + "}";
        }
    }
}
