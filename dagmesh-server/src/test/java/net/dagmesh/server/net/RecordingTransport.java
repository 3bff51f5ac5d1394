/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.net;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import net.dagmesh.core.GossipMessage;
import net.dagmesh.core.MessageType;

/**
 * Remembers every outbound message and refuses sends to blocked peers.
 */
public class RecordingTransport implements Transport {

    public static class Sent {
        public final String peer;
        public final GossipMessage message;

        Sent(String peer, GossipMessage message) {
            this.peer = peer;
            this.message = message;
        }
    }

    private final Transport delegate;
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final List<Sent> sent = new CopyOnWriteArrayList<Sent>();

    public RecordingTransport(Transport delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean send(String peerId, byte[] data) {
        try {
            sent.add(new Sent(peerId, GossipMessage.parse(data)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (blocked.contains(peerId)) {
            return false;
        }
        return delegate.send(peerId, data);
    }

    public void block(String peerId) {
        blocked.add(peerId);
    }

    public void unblock(String peerId) {
        blocked.remove(peerId);
    }

    public List<GossipMessage> sent(MessageType type) {
        List<GossipMessage> result = new ArrayList<GossipMessage>();
        for (Sent s : sent) {
            if (s.message.getType() == type) {
                result.add(s.message);
            }
        }
        return result;
    }

    public List<GossipMessage> sentTo(String peerId, MessageType type) {
        List<GossipMessage> result = new ArrayList<GossipMessage>();
        for (Sent s : sent) {
            if (s.peer.equals(peerId) && s.message.getType() == type) {
                result.add(s.message);
            }
        }
        return result;
    }

    public List<Sent> getSent() {
        return sent;
    }

    public void clear() {
        sent.clear();
    }
}
