/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import java.util.Map;

import net.dagmesh.core.GossipMessage;

/**
 * Produces the payload of the SYNC_RESPONSE for an inbound SYNC_REQUEST.
 */
public interface SyncRequestResponder {

    /**
     * @return the response payload, or null when the request is not answered
     */
    Map<String, Object> respond(GossipMessage request, String from);
}
