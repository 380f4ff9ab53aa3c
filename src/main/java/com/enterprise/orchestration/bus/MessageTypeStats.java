package com.enterprise.orchestration.bus;

/**
 * Message counts for one message type
 */
public class MessageTypeStats {

    private int total;
    private int delivered;
    private int failed;
    private int pending;

    void record(MessageStatus status) {
        total++;
        switch (status) {
            case DELIVERED:
                delivered++;
                break;
            case FAILED:
                failed++;
                break;
            default:
                pending++;
        }
    }

    public int getTotal() { return total; }

    public int getDelivered() { return delivered; }

    public int getFailed() { return failed; }

    public int getPending() { return pending; }

    @Override
    public String toString() {
        return "MessageTypeStats{" +
                "total=" + total +
                ", delivered=" + delivered +
                ", failed=" + failed +
                ", pending=" + pending +
                '}';
    }
}
