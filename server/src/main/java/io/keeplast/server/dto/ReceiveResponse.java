package io.keeplast.server.dto;

public final class ReceiveResponse {
    public boolean ok;
    public boolean applied;
}
