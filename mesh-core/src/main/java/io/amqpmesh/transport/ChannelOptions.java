package io.amqpmesh.transport;

/**
 * Per-channel hints passed to the transport.
 *
 * @param json when {@code true}, payloads sent on the channel are tagged {@code application/json}
 */
public record ChannelOptions(boolean json) {

    private static final ChannelOptions JSON = new ChannelOptions(true);
    private static final ChannelOptions RAW = new ChannelOptions(false);

    public static ChannelOptions forJson() {
        return JSON;
    }

    public static ChannelOptions forRaw() {
        return RAW;
    }
}
