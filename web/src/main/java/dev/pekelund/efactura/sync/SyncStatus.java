package dev.pekelund.efactura.sync;

public enum SyncStatus {
    COMPLETED,
    ABORTED,
    DISABLED,
    UNKNOWN_COMPANY
}
