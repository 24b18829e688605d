package flowbuf.udp;

import java.net.InetSocketAddress;

/**
 * A UDP exporting process: its address and port, and the observation domain
 * it exports.
 */
public record PeerKey(InetSocketAddress address, long domain) {

    @Override
    public String toString() {
        return address + "/" + domain;
    }

}
