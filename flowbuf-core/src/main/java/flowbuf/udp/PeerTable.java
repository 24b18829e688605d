package flowbuf.udp;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import flowbuf.session.Session;

/**
 * One session for each UDP peer. Peers not seen during the idle timeout are
 * evicted and their sessions closed.
 */
public class PeerTable {

    private static final Logger logger = LogManager.getLogger();

    private static class Peer {
        private final Session session;
        private long lastSeen;
        private Peer(Session session, long lastSeen) {
            this.session = session;
            this.lastSeen = lastSeen;
        }
    }

    private final Session prototype;
    private final long idleTimeout;
    // Access ordered, so the least recently seen peer comes first
    private final Map<PeerKey, Peer> peers = new LinkedHashMap<>(16, 0.75f, true);

    /**
     * @param prototype the session whose internal templates, pairings and
     *        new template callback are given to each new peer
     * @param idleTimeout in milliseconds
     */
    public PeerTable(Session prototype, long idleTimeout) {
        this.prototype = prototype;
        this.idleTimeout = idleTimeout;
    }

    /**
     * The session of a peer, created if needed. Idle peers are evicted first.
     */
    public Session lookup(PeerKey key, long now) {
        reap(now);
        Peer peer = peers.get(key);
        if (peer == null) {
            Session session = prototype.cloneForPeer();
            session.setDomain(key.domain());
            peer = new Peer(session, now);
            peers.put(key, peer);
            logger.debug("New peer {}", key);
        } else {
            peer.lastSeen = now;
        }
        return peer.session;
    }

    /**
     * Evict the peers idle since <code>now - idleTimeout</code>.
     *
     * @return the number of peers evicted
     */
    public int reap(long now) {
        int count = 0;
        Iterator<Map.Entry<PeerKey, Peer>> i = peers.entrySet().iterator();
        while (i.hasNext()) {
            Map.Entry<PeerKey, Peer> e = i.next();
            if (now - e.getValue().lastSeen <= idleTimeout) {
                break;
            }
            logger.debug("Evicting idle peer {}", e.getKey());
            e.getValue().session.close();
            i.remove();
            count++;
        }
        return count;
    }

    public boolean remove(PeerKey key) {
        Peer peer = peers.remove(key);
        if (peer != null) {
            peer.session.close();
            return true;
        } else {
            return false;
        }
    }

    public boolean contains(PeerKey key) {
        return peers.containsKey(key);
    }

    public int size() {
        return peers.size();
    }

    public void clear() {
        peers.values().forEach(p -> p.session.close());
        peers.clear();
    }

}
