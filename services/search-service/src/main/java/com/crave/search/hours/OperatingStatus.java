package com.crave.search.hours;

import com.fasterxml.jackson.annotation.JsonProperty;

public class OperatingStatus {
    @JsonProperty("is_open")
    private boolean open;

    @JsonProperty("closes_at_display")
    private String closesAtDisplay;

    @JsonProperty("closes_in_minutes")
    private Integer closesInMinutes;

    @JsonProperty("next_open_display")
    private String nextOpenDisplay;

    public OperatingStatus() {
    }

    private OperatingStatus(boolean open, String closesAtDisplay, Integer closesInMinutes, String nextOpenDisplay) {
        this.open = open;
        this.closesAtDisplay = closesAtDisplay;
        this.closesInMinutes = closesInMinutes;
        this.nextOpenDisplay = nextOpenDisplay;
    }

    public static OperatingStatus openUntil(String closesAtDisplay, int closesInMinutes) {
        return new OperatingStatus(true, closesAtDisplay, closesInMinutes, null);
    }

    public static OperatingStatus closed(String nextOpenDisplay) {
        return new OperatingStatus(false, null, null, nextOpenDisplay);
    }

    public boolean isOpen() {
        return open;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public String getClosesAtDisplay() {
        return closesAtDisplay;
    }

    public void setClosesAtDisplay(String closesAtDisplay) {
        this.closesAtDisplay = closesAtDisplay;
    }

    public Integer getClosesInMinutes() {
        return closesInMinutes;
    }

    public void setClosesInMinutes(Integer closesInMinutes) {
        this.closesInMinutes = closesInMinutes;
    }

    public String getNextOpenDisplay() {
        return nextOpenDisplay;
    }

    public void setNextOpenDisplay(String nextOpenDisplay) {
        this.nextOpenDisplay = nextOpenDisplay;
    }
}
