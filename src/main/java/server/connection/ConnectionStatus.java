package server.connection;

public enum ConnectionStatus {
    ACTIVE,
    CLOSED
}
