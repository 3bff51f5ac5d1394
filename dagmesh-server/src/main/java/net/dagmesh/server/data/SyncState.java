/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.data;

public enum SyncState {
    IDLE, SYNCING, VALIDATING, ERROR
}
