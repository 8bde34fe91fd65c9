package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Controls whether the projection history survives a restart. When
 * {@code save-history} is off, the history is wiped on close instead of
 * being persisted.
 */
public class HistoryConfig {

    @JsonProperty("save-history")
    private boolean saveHistory = true;

    @JsonProperty("max-entries")
    private int maxEntries = 100;

    public boolean isSaveHistory() {
        return saveHistory;
    }

    public void setSaveHistory(boolean saveHistory) {
        this.saveHistory = saveHistory;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }
}
