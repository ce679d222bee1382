package archive.ingest.common;

/**
 * Operational state of the archive service, passed explicitly into every archive call.
 */
public enum ServiceState {
    ONLINE_IDLE(true),
    ONLINE_BUSY(true),
    OFFLINE(false);

    private final boolean accepting;

    ServiceState(boolean accepting) {
        this.accepting = accepting;
    }

    /**
     * @return whether new archive requests may be started in this state
     */
    public boolean isAccepting() {
        return accepting;
    }
}
