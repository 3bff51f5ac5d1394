/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import net.dagmesh.core.GossipMessage;

public interface GossipMessageListener {

    /**
     * @param from the peer that handed the message over, not necessarily its
     *            originator
     */
    void onMessage(GossipMessage message, String from);
}
