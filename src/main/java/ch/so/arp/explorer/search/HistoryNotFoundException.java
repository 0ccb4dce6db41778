package ch.so.arp.explorer.search;

/** Exception thrown when a history record is not found. */
public class HistoryNotFoundException extends RuntimeException {

    private final String historyId;

    public HistoryNotFoundException(String historyId) {
        super("History record not found: " + historyId);
        this.historyId = historyId;
    }

    public String getHistoryId() {
        return historyId;
    }
}
